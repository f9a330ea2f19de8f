///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//DEPS com.hackerhermanos:wordmerge-cli:1.0.0-SNAPSHOT

import com.hackerhermanos.wordmerge.cli.WordMergeCli;

public class wordmerge {
    public static void main(String[] args) throws Exception {
        WordMergeCli.main(args);
    }
}
