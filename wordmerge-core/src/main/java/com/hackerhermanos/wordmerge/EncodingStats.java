package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Encoding resolution and conversion counters shared by all ingestion workers of a run.
 */
public class EncodingStats {

	private static final Logger logger = LoggerFactory.getLogger(EncodingStats.class);

	private static final String[] UNITS = { "B", "KB", "MB", "GB", "TB" };

	private final LongAdder filesProcessed = new LongAdder();

	private final LongAdder conversionErrors = new LongAdder();

	private final LongAdder replacementCharacters = new LongAdder();

	private final LongAdder bytesProcessed = new LongAdder();

	private final Map<String, LongAdder> detected = new ConcurrentHashMap<>();

	private final Map<String, LongAdder> forced = new ConcurrentHashMap<>();

	private final Map<String, LongAdder> fallback = new ConcurrentHashMap<>();

	private final long startNanos = System.nanoTime();

	/**
	 * Count a resolved file under detected, forced or fallback depending on its basis.
	 */
	public void recordResolution(EncodingProfile profile) {
		filesProcessed.increment();
		Map<String, LongAdder> target = switch (profile.basis()) {
			case FORCED -> forced;
			case FALLBACK, SIZE_CEILING -> fallback;
			default -> detected;
		};
		target.computeIfAbsent(profile.name(), k -> new LongAdder()).increment();
	}

	/**
	 * Record the outcome of converting one file.
	 * @param bytes bytes read from the file
	 * @param replacements number of U+FFFD characters produced
	 */
	public void recordConversion(long bytes, long replacements) {
		bytesProcessed.add(bytes);
		if (replacements > 0) {
			conversionErrors.increment();
			replacementCharacters.add(replacements);
		}
	}

	public long filesProcessed() {
		return filesProcessed.sum();
	}

	public long conversionErrors() {
		return conversionErrors.sum();
	}

	public long replacementCharacters() {
		return replacementCharacters.sum();
	}

	public long bytesProcessed() {
		return bytesProcessed.sum();
	}

	public Map<String, Long> detectedCounts() {
		return snapshot(detected);
	}

	public Map<String, Long> forcedCounts() {
		return snapshot(forced);
	}

	public Map<String, Long> fallbackCounts() {
		return snapshot(fallback);
	}

	public Duration elapsed() {
		return Duration.ofNanos(System.nanoTime() - startNanos);
	}

	/**
	 * Percentage of files converted without replacement characters.
	 * @return 0-100, or 100 when no file has been processed
	 */
	public double successRate() {
		long files = filesProcessed();
		if (files == 0) {
			return 100.0;
		}
		long clean = Math.max(0, files - conversionErrors());
		return clean * 100.0 / files;
	}

	/**
	 * Charset used for the most files, across all resolution kinds.
	 */
	public Optional<String> mostCommonEncoding() {
		Map<String, Long> totals = new TreeMap<>();
		for (Map<String, LongAdder> source : List.of(detected, forced, fallback)) {
			source.forEach((name, count) -> totals.merge(name, count.sum(), Long::sum));
		}
		return totals.entrySet().stream().max(Map.Entry.comparingByValue()).map(Map.Entry::getKey);
	}

	/**
	 * Add another run's counters into this one. Timing is not merged.
	 */
	public void merge(EncodingStats other) {
		filesProcessed.add(other.filesProcessed());
		conversionErrors.add(other.conversionErrors());
		replacementCharacters.add(other.replacementCharacters());
		bytesProcessed.add(other.bytesProcessed());
		mergeCounts(detected, other.detected);
		mergeCounts(forced, other.forced);
		mergeCounts(fallback, other.fallback);
	}

	public void logSummary() {
		logger.info("Encoding: {} files, {} processed, {}% clean, most common: {}", filesProcessed(),
				formatBytes(bytesProcessed()), String.format(Locale.ROOT, "%.1f", successRate()),
				mostCommonEncoding().orElse("n/a"));
	}

	/**
	 * Multi-line report for verbose output.
	 */
	public String summary() {
		StringBuilder report = new StringBuilder();
		report.append("Encoding statistics:\n");
		report.append("  Files processed: ").append(filesProcessed()).append('\n');
		report.append("  Bytes processed: ").append(formatBytes(bytesProcessed())).append('\n');
		report.append("  Elapsed: ").append(elapsed().toMillis()).append(" ms\n");
		appendCounts(report, "Detected", detectedCounts());
		appendCounts(report, "Forced", forcedCounts());
		appendCounts(report, "Fallback", fallbackCounts());
		report.append("  Files with replacement characters: ").append(conversionErrors()).append('\n');
		report.append("  Replacement characters: ").append(replacementCharacters()).append('\n');
		report.append("  Success rate: ").append(String.format(Locale.ROOT, "%.1f%%", successRate()));
		return report.toString();
	}

	/**
	 * Human readable size in decimal units, e.g. {@code 1.0 KB} for 1024 bytes.
	 */
	public static String formatBytes(long bytes) {
		if (bytes < 1000) {
			return bytes + " B";
		}
		double value = bytes;
		int unit = 0;
		while (value >= 1000 && unit < UNITS.length - 1) {
			value /= 1000;
			unit++;
		}
		return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
	}

	private static void appendCounts(StringBuilder report, String label, Map<String, Long> counts) {
		if (counts.isEmpty()) {
			return;
		}
		report.append("  ").append(label).append(":\n");
		counts.forEach((name, count) -> report.append("    ").append(name).append(": ").append(count).append('\n'));
	}

	private static Map<String, Long> snapshot(Map<String, LongAdder> counts) {
		Map<String, Long> copy = new TreeMap<>();
		counts.forEach((name, count) -> copy.put(name, count.sum()));
		return copy;
	}

	private static void mergeCounts(Map<String, LongAdder> target, Map<String, LongAdder> source) {
		source.forEach((name, count) -> target.computeIfAbsent(name, k -> new LongAdder()).add(count.sum()));
	}

}
