package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * File system implementation of {@link CheckpointStore}.
 *
 * <p>
 * Each project is persisted to {@code {stateDir}/{project}.json}. A flush writes
 * {@code {project}.json.tmp}, forces it to disk and moves it over the previous file, so
 * a reader always sees either the old or the new checkpoint in full.
 */
public class FileSystemCheckpointStore implements CheckpointStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCheckpointStore.class);

	private static final Pattern PROJECT_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

	private final Path stateDir;

	private final ObjectMapper objectMapper;

	private final Map<String, ProjectState> states = new HashMap<>();

	private final Set<String> dirty = new LinkedHashSet<>();

	public FileSystemCheckpointStore(Path stateDir, ObjectMapper objectMapper) {
		this.stateDir = stateDir;
		this.objectMapper = objectMapper;
	}

	@Override
	public Checkpoint load(String project) {
		return state(project).snapshot(project);
	}

	@Override
	public boolean isProcessed(String project, String issueKey) {
		return state(project).processedKeys.contains(issueKey);
	}

	@Override
	public void recordProcessed(String project, String issueKey) {
		if (state(project).processedKeys.add(issueKey)) {
			dirty.add(project);
		}
	}

	@Override
	public void advanceWatermark(String project, Instant timestamp) {
		ProjectState state = state(project);
		if (timestamp.isAfter(state.watermark)) {
			state.watermark = timestamp;
			dirty.add(project);
		}
	}

	@Override
	public void flush() {
		for (String project : Set.copyOf(dirty)) {
			Checkpoint checkpoint = states.get(project).snapshot(project);
			write(project, checkpoint);
			dirty.remove(project);
			logger.debug("Flushed checkpoint for {}: watermark={}, processed={}", project,
					checkpoint.lastUpdateTimestamp(), checkpoint.processedKeys().size());
		}
	}

	Path checkpointFile(String project) {
		if (!PROJECT_NAME.matcher(project).matches()) {
			throw new IllegalArgumentException("Invalid project name: " + project);
		}
		return stateDir.resolve(project + ".json");
	}

	/**
	 * Write the serialized checkpoint to the temporary file and force it to disk.
	 */
	protected void writeTemporary(Path tmp, byte[] content) throws IOException {
		try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
				StandardOpenOption.TRUNCATE_EXISTING)) {
			ByteBuffer buffer = ByteBuffer.wrap(content);
			while (buffer.hasRemaining()) {
				channel.write(buffer);
			}
			channel.force(true);
		}
	}

	private void write(String project, Checkpoint checkpoint) {
		Path target = checkpointFile(project);
		Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
		try {
			Files.createDirectories(stateDir);
			Checkpoint sorted = new Checkpoint(project, checkpoint.lastUpdateTimestamp(),
					new TreeSet<>(checkpoint.processedKeys()));
			writeTemporary(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(sorted));
			try {
				Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException e) {
				logger.warn("Atomic move not supported in {}, falling back to plain replace", stateDir);
				Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		catch (IOException e) {
			throw new StorageException("Failed to write checkpoint for " + project + " to " + target, e);
		}
	}

	private ProjectState state(String project) {
		return states.computeIfAbsent(project, this::read);
	}

	private ProjectState read(String project) {
		Path file = checkpointFile(project);
		if (!Files.exists(file)) {
			logger.debug("No checkpoint for {} at {}", project, file);
			return new ProjectState(Instant.EPOCH, Set.of());
		}
		try {
			Checkpoint checkpoint = objectMapper.readValue(file.toFile(), Checkpoint.class);
			Instant watermark = checkpoint.lastUpdateTimestamp() != null ? checkpoint.lastUpdateTimestamp()
					: Instant.EPOCH;
			Set<String> keys = checkpoint.processedKeys() != null ? checkpoint.processedKeys() : Set.of();
			logger.info("Loaded checkpoint for {}: watermark={}, processed={}", project, watermark, keys.size());
			return new ProjectState(watermark, keys);
		}
		catch (IOException e) {
			logger.warn("Checkpoint for {} at {} is unreadable, starting from scratch: {}", project, file,
					e.getMessage());
			return new ProjectState(Instant.EPOCH, Set.of());
		}
	}

	private static final class ProjectState {

		private Instant watermark;

		private final Set<String> processedKeys;

		ProjectState(Instant watermark, Set<String> processedKeys) {
			this.watermark = watermark;
			this.processedKeys = new LinkedHashSet<>(processedKeys);
		}

		Checkpoint snapshot(String project) {
			return new Checkpoint(project, watermark, Set.copyOf(processedKeys));
		}

	}

}
