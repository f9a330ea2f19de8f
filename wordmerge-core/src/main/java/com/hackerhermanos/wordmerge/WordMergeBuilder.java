package com.hackerhermanos.wordmerge;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for wiring merge services without a dependency injection container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults: memory-aware batching, file system checkpoints, ICU detection
 * MergeService service = WordMergeBuilder.create().buildMergeService();
 *
 * // With custom configuration
 * MergeProperties props = new MergeProperties();
 * props.setChannelCapacity(64);
 *
 * MergeService service = WordMergeBuilder.create()
 *     .properties(props)
 *     .listener(new LoggingMergeListener())
 *     .buildMergeService();
 *
 * // For testing with fixed batch limits
 * MergeService testService = WordMergeBuilder.create()
 *     .batchStrategy(new FixedBatchStrategy(1000, 1024 * 1024))
 *     .buildMergeService();
 * }
 * </pre>
 */
public class WordMergeBuilder {

	private MergeProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable MemoryProbe memoryProbe;

	private @Nullable BatchStrategy batchStrategy;

	private @Nullable CheckpointStore checkpointStore;

	private @Nullable CharsetGuesser charsetGuesser;

	private @Nullable MergeListener listener;

	private WordMergeBuilder() {
		this.properties = new MergeProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new WordMergeBuilder
	 */
	public static WordMergeBuilder create() {
		return new WordMergeBuilder();
	}

	/**
	 * Set merge properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public WordMergeBuilder properties(@Nullable MergeProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public WordMergeBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set the memory probe used by the default memory-aware batch strategy.
	 * @param memoryProbe probe (null to use the system probe)
	 * @return this builder
	 */
	public WordMergeBuilder memoryProbe(@Nullable MemoryProbe memoryProbe) {
		this.memoryProbe = memoryProbe;
		return this;
	}

	/**
	 * Set a custom BatchStrategy. Overrides the memory probe.
	 * @param batchStrategy strategy (null to use the memory-aware default)
	 * @return this builder
	 */
	public WordMergeBuilder batchStrategy(@Nullable BatchStrategy batchStrategy) {
		this.batchStrategy = batchStrategy;
		return this;
	}

	/**
	 * Set a custom CheckpointStore implementation. Useful for testing with mocks.
	 * @param checkpointStore store (null to use the file system store)
	 * @return this builder
	 */
	public WordMergeBuilder checkpointStore(@Nullable CheckpointStore checkpointStore) {
		this.checkpointStore = checkpointStore;
		return this;
	}

	/**
	 * Set a custom CharsetGuesser.
	 * @param charsetGuesser guesser (null to use ICU4J)
	 * @return this builder
	 */
	public WordMergeBuilder charsetGuesser(@Nullable CharsetGuesser charsetGuesser) {
		this.charsetGuesser = charsetGuesser;
		return this;
	}

	/**
	 * Set the progress listener.
	 * @param listener listener (null for no callbacks)
	 * @return this builder
	 */
	public WordMergeBuilder listener(@Nullable MergeListener listener) {
		this.listener = listener;
		return this;
	}

	/**
	 * Build a merge service.
	 * @return configured MergeService
	 */
	public MergeService buildMergeService() {
		Components components = buildComponents();
		return new MergeService(properties, components.batchStrategy(), components.checkpointStore(),
				components.charsetGuesser(), listener != null ? listener : MergeListener.NONE);
	}

	/**
	 * Build a config file repository sharing this builder's ObjectMapper.
	 * @return configured MergeConfigRepository
	 */
	public MergeConfigRepository buildConfigRepository() {
		return new MergeConfigRepository(resolveObjectMapper());
	}

	private ObjectMapper resolveObjectMapper() {
		return objectMapper != null ? objectMapper : ObjectMapperFactory.create();
	}

	private Components buildComponents() {
		ObjectMapper mapper = resolveObjectMapper();
		BatchStrategy strategy = batchStrategy != null ? batchStrategy : new MemoryAwareBatchStrategy(
				memoryProbe != null ? memoryProbe : new SystemMemoryProbe(), properties);
		CheckpointStore store = checkpointStore != null ? checkpointStore : new FileSystemCheckpointStore(mapper);
		CharsetGuesser guesser = charsetGuesser != null ? charsetGuesser : new IcuCharsetGuesser();
		return new Components(strategy, store, guesser);
	}

	private record Components(BatchStrategy batchStrategy, CheckpointStore checkpointStore,
			CharsetGuesser charsetGuesser) {
	}

}
