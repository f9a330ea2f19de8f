package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.OptionalLong;

/**
 * {@link MemoryProbe} reporting the smaller of free physical memory and the JVM heap
 * headroom.
 */
public class SystemMemoryProbe implements MemoryProbe {

	private static final Logger logger = LoggerFactory.getLogger(SystemMemoryProbe.class);

	@Override
	public OptionalLong availableBytes() {
		OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
		if (!(bean instanceof com.sun.management.OperatingSystemMXBean osBean)) {
			logger.warn("Platform does not expose physical memory information");
			return OptionalLong.empty();
		}
		long physicalFree = osBean.getFreeMemorySize();
		if (physicalFree <= 0) {
			return OptionalLong.empty();
		}
		Runtime runtime = Runtime.getRuntime();
		long heapHeadroom = runtime.maxMemory() - (runtime.totalMemory() - runtime.freeMemory());
		long available = Math.min(physicalFree, heapHeadroom);
		logger.debug("Free physical memory {} bytes, heap headroom {} bytes", physicalFree, heapHeadroom);
		return OptionalLong.of(available);
	}

}
