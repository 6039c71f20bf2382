package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;

/**
 * File system implementation of {@link RawRecordStore}.
 *
 * <p>
 * Writes {@code {rawDir}/{project}/{key}.json} through a temporary file so a partially
 * written record is never visible under its final name.
 */
public class FileSystemRawRecordStore implements RawRecordStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemRawRecordStore.class);

	private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

	private final Path rawDir;

	private final ObjectMapper objectMapper;

	public FileSystemRawRecordStore(Path rawDir, ObjectMapper objectMapper) {
		this.rawDir = rawDir;
		this.objectMapper = objectMapper;
	}

	@Override
	public String store(Issue issue) {
		Path target = recordFile(issue.project(), issue.key());
		Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
		try {
			Files.createDirectories(target.getParent());
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), issue);
			try {
				Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
			}
			logger.debug("Stored {} to {}", issue.key(), target);
			return target.toString();
		}
		catch (IOException e) {
			throw new StorageException("Failed to store raw record " + issue.key() + " to " + target, e);
		}
	}

	Path recordFile(String project, String issueKey) {
		if (!SAFE_NAME.matcher(project).matches() || !SAFE_NAME.matcher(issueKey).matches()) {
			throw new IllegalArgumentException("Unsafe project or issue key: " + project + "/" + issueKey);
		}
		return rawDir.resolve(project).resolve(issueKey + ".json");
	}

}
