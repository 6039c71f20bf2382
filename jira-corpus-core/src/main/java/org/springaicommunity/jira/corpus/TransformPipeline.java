package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Transforms raw issue records into a JSON Lines corpus.
 *
 * <p>
 * Reads every {@code *.json} file below the input directory, in path order. Files may hold
 * either a stored {@link Issue} or an issue exactly as returned by the Jira API. Records
 * that cannot be read or validated are logged and skipped; every other record becomes
 * one line of the output file, which is replaced on each run.
 */
public class TransformPipeline {

	private static final Logger logger = LoggerFactory.getLogger(TransformPipeline.class);

	private final ObjectMapper objectMapper;

	private final JiraIssueParser issueParser;

	private final CorpusTaskBuilder taskBuilder;

	public TransformPipeline(ObjectMapper objectMapper, JiraIssueParser issueParser, CorpusTaskBuilder taskBuilder) {
		this.objectMapper = objectMapper;
		this.issueParser = issueParser;
		this.taskBuilder = taskBuilder;
	}

	/**
	 * Build the corpus.
	 * @param inputDirectory root of the raw record tree
	 * @param outputPath JSON Lines file to write; parent directories are created
	 * @param projectFilter projects to include, matched ignoring case, or null/empty for
	 * all
	 * @return number of lines written
	 * @throws IllegalArgumentException if the input directory does not exist
	 * @throws StorageException if the input cannot be listed or the output cannot be
	 * written
	 */
	public int transform(Path inputDirectory, Path outputPath, @Nullable Collection<String> projectFilter) {
		if (!Files.isDirectory(inputDirectory)) {
			throw new IllegalArgumentException("Input directory does not exist: " + inputDirectory);
		}

		Set<String> projects = projectFilter == null ? Set.of() : projectFilter.stream()
			.map(project -> project.trim().toUpperCase(Locale.ROOT))
			.collect(Collectors.toSet());
		List<Path> files = listRecordFiles(inputDirectory);
		logger.info("Building corpus from {} record files in {} to {}", files.size(), inputDirectory, outputPath);

		int written = 0;
		int skipped = 0;
		try {
			Path parent = outputPath.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			try (BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
				for (Path file : files) {
					String project = projectOf(inputDirectory, file).toUpperCase(Locale.ROOT);
					if (!projects.isEmpty() && !projects.contains(project)) {
						continue;
					}

					Optional<Issue> issue = readIssue(file);
					if (issue.isEmpty()) {
						skipped++;
						continue;
					}

					CorpusEntry entry = taskBuilder.build(issue.get());
					writer.write(objectMapper.writeValueAsString(entry));
					writer.write('\n');
					written++;
				}
			}
		}
		catch (IOException e) {
			throw new StorageException("Failed to write corpus to " + outputPath, e);
		}

		logger.info("Corpus built: {} entries written to {} ({} records skipped)", written, outputPath, skipped);
		return written;
	}

	Optional<Issue> readIssue(Path file) {
		try {
			JsonNode node = objectMapper.readTree(file.toFile());
			if (node == null || !node.isObject()) {
				logger.warn("Skipping {}: not a JSON object", file);
				return Optional.empty();
			}
			Issue issue = node.has("fields") ? issueParser.parse(node)
					: objectMapper.treeToValue(node, Issue.class).validated();
			return Optional.of(issue);
		}
		catch (IOException e) {
			logger.warn("Skipping unreadable record {}: {}", file, e.getMessage());
			return Optional.empty();
		}
		catch (IssueValidationException e) {
			logger.warn("Skipping invalid record {}: {}", file, e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * The project a record file belongs to: its directory name, or the key prefix of the
	 * file name for files directly under the input directory.
	 */
	static String projectOf(Path inputDirectory, Path file) {
		Path parent = file.getParent();
		if (parent != null && !parent.equals(inputDirectory)) {
			return parent.getFileName().toString();
		}
		String name = file.getFileName().toString();
		return Issue.projectOf(name.substring(0, name.length() - ".json".length()));
	}

	private List<Path> listRecordFiles(Path inputDirectory) {
		try (Stream<Path> paths = Files.walk(inputDirectory)) {
			return paths.filter(Files::isRegularFile)
				.filter(path -> path.getFileName().toString().endsWith(".json"))
				.sorted()
				.collect(Collectors.toList());
		}
		catch (IOException e) {
			throw new StorageException("Failed to list record files in " + inputDirectory, e);
		}
	}

}
