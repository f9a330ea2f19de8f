package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for merge runs.
 *
 * <p>
 * A run is prepared first, which reads the input list and loads or creates the
 * checkpoint, and then executed. Preparing separately gives callers access to the run's
 * {@link ShutdownCoordinator} before any file is read:
 *
 * <pre>
 * {@code
 * MergeService service = WordMergeBuilder.create().buildMergeService();
 * MergeRun run = service.prepare(MergeRequest.of(list, output, 10, EncodingStrategy.autoDetect()));
 * run.coordinator().installShutdownHook(Duration.ofSeconds(30));
 * MergeResult result = run.execute();
 * }
 * </pre>
 */
public class MergeService {

	private static final Logger logger = LoggerFactory.getLogger(MergeService.class);

	private final MergeProperties properties;

	private final BatchStrategy batchStrategy;

	private final CheckpointStore checkpointStore;

	private final EncodingDetector detector;

	private final MergeListener listener;

	public MergeService(MergeProperties properties, BatchStrategy batchStrategy, CheckpointStore checkpointStore,
			CharsetGuesser guesser, MergeListener listener) {
		this.properties = properties;
		this.batchStrategy = batchStrategy;
		this.checkpointStore = checkpointStore;
		this.listener = listener;
		this.detector = new EncodingDetector(guesser, new EncodingValidator(), WordlistEncodings.COMMON,
				properties.getSampleSize(), properties.getDetectionCeiling());
	}

	/**
	 * Prepare and execute a run.
	 */
	public MergeResult merge(MergeRequest request) {
		return prepare(request).execute();
	}

	/**
	 * Read the input list and create, or for a resumed request load, the checkpoint
	 * state.
	 * @param request run parameters
	 * @return a run ready to execute
	 * @throws MergeException if the input list is unreadable or the checkpoint cannot be
	 * resumed
	 */
	public MergeRun prepare(MergeRequest request) {
		ProgressState state;
		if (request.resume()) {
			state = checkpointStore.load(request.checkpoint());
			verifyResumable(state, request);
		}
		else {
			state = new ProgressState(request.inputList(), request.output(), request.threads(),
					request.checkpoint());
		}
		List<Path> inputs = InputListReader.read(request.inputList());
		logger.info("Read {} input paths from {}", inputs.size(), request.inputList());

		ProgressTracker tracker = new ProgressTracker(state, checkpointStore);
		ShutdownFlag flag = new ShutdownFlag();
		ErrorLog errorLog = new ErrorLog(Path.of(properties.getErrorLogFile()));
		return new MergeRun(request, inputs, tracker, flag, new ShutdownCoordinator(tracker, flag), errorLog,
				properties, batchStrategy, detector, listener);
	}

	/**
	 * Prepare a run that continues from a checkpoint, taking input, output and thread
	 * count from it.
	 * @param checkpoint checkpoint file
	 * @param encoding charset strategy for the remaining files
	 * @return a run ready to execute
	 */
	public MergeRun prepareResume(Path checkpoint, EncodingStrategy encoding) {
		ProgressState state = checkpointStore.load(checkpoint);
		int threads = state.getThreadCount() > 0 ? state.getThreadCount() : properties.getDefaultThreads();
		MergeRequest request = new MergeRequest(Path.of(state.getInputFile()), Path.of(state.getOutputFile()),
				threads, encoding, checkpoint, true);
		return prepare(request);
	}

	private static void verifyResumable(ProgressState state, MergeRequest request) {
		Path recordedInput = Path.of(state.getInputFile());
		if (!Files.isRegularFile(recordedInput)) {
			throw new MergeException(ErrorKind.RESUME,
					"Input files have changed, recorded input list no longer exists: " + recordedInput);
		}
		if (!recordedInput.toAbsolutePath().normalize().equals(request.inputList().toAbsolutePath().normalize())) {
			throw new MergeException(ErrorKind.RESUME, "Input files have changed, checkpoint was created for "
					+ recordedInput + " but " + request.inputList() + " was requested");
		}
	}

}
