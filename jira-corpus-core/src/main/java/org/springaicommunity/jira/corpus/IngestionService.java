package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives incremental ingestion of Jira projects into the raw record store.
 *
 * <p>
 * Projects are processed one after another. For each project the checkpoint supplies the
 * lower bound of the search and the set of keys to skip; every stored issue is recorded
 * in the checkpoint, which is flushed after each page and every
 * {@link CorpusProperties#getCheckpointInterval()} stored issues.
 *
 * <p>
 * Failures are contained as narrowly as possible: an issue that cannot be fetched or
 * validated is skipped, an unusable project key, a failing search page or a repeated
 * raw-store failure ends the project, and only a checkpoint that cannot be persisted ends the run.
 */
public class IngestionService {

	private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

	private final RestService restService;

	private final JiraIssueParser issueParser;

	private final CheckpointStore checkpointStore;

	private final RawRecordStore rawRecordStore;

	private final CorpusProperties properties;

	public IngestionService(RestService restService, JiraIssueParser issueParser, CheckpointStore checkpointStore,
			RawRecordStore rawRecordStore, CorpusProperties properties) {
		this.restService = restService;
		this.issueParser = issueParser;
		this.checkpointStore = checkpointStore;
		this.rawRecordStore = rawRecordStore;
		this.properties = properties;
	}

	/**
	 * Ingest every project named by the request.
	 * @param request the run parameters
	 * @return per-project outcomes
	 * @throws StorageException if a checkpoint cannot be flushed; no further project is
	 * attempted
	 */
	public IngestionResult ingest(IngestionRequest request) {
		IngestionRequest validated = request.validated(properties);
		logger.info("Starting ingestion for projects {} (startDate={}, maxIssues={})", validated.projects(),
				validated.startDate(), validated.maxIssues() != null ? validated.maxIssues() : "unlimited");

		List<ProjectIngestionResult> results = new ArrayList<>();
		for (String project : validated.projects()) {
			results.add(ingestProject(project, validated));
		}

		IngestionResult result = new IngestionResult(List.copyOf(results));
		logger.info("Ingestion finished: {} issues stored from {} hits across {} projects", result.totalStored(),
				result.totalExamined(), results.size());
		return result;
	}

	/**
	 * Ingest a single project.
	 */
	ProjectIngestionResult ingestProject(String project, IngestionRequest request) {
		ProjectRun run = new ProjectRun(project, request.maxIssues());
		Checkpoint checkpoint = null;
		try {
			checkpoint = loadCheckpoint(project);
			Instant lowerBound = lowerBound(checkpoint, request);
			String jql = restService.buildJql(project, lowerBound);
			logger.info("Ingesting {} from {} ({} keys already processed)", project, lowerBound,
					checkpoint.processedKeys().size());
			run.execute(jql);
		}
		catch (ProjectAbortedException e) {
			logger.error("Aborting project {}: {}", project, e.getMessage());
			run.abortReason = e.getMessage();
		}
		finally {
			// Progress made before an abort is kept.
			checkpointStore.flush();
		}

		Instant watermark = checkpoint != null ? checkpointStore.load(project).lastUpdateTimestamp() : Instant.EPOCH;
		logger.info("Project {} done: examined={}, stored={}, duplicates={}, invalid={}, failedFetches={}, watermark={}",
				project, run.examined, run.stored, run.duplicates, run.invalid, run.failedFetches, watermark);
		return new ProjectIngestionResult(project, run.examined, run.stored, run.duplicates, run.invalid,
				run.failedFetches, watermark, run.abortReason != null, run.abortReason);
	}

	private Checkpoint loadCheckpoint(String project) {
		try {
			return checkpointStore.load(project);
		}
		catch (IllegalArgumentException e) {
			throw new ProjectAbortedException("invalid project key '" + project + "'", e);
		}
	}

	/**
	 * The latest of the checkpoint watermark, the requested start date and the epoch.
	 */
	static Instant lowerBound(Checkpoint checkpoint, IngestionRequest request) {
		Instant bound = Instant.EPOCH;
		if (checkpoint.lastUpdateTimestamp().isAfter(bound)) {
			bound = checkpoint.lastUpdateTimestamp();
		}
		if (request.startDate() != null) {
			Instant start = request.startDate().atStartOfDay(ZoneOffset.UTC).toInstant();
			if (start.isAfter(bound)) {
				bound = start;
			}
		}
		return bound;
	}

	/**
	 * Pagination and per-issue state for one project.
	 */
	private final class ProjectRun {

		private final String project;

		@Nullable
		private final Integer maxIssues;

		private int examined;

		private int stored;

		private int duplicates;

		private int invalid;

		private int failedFetches;

		private int storedSinceFlush;

		@Nullable
		private String abortReason;

		ProjectRun(String project, @Nullable Integer maxIssues) {
			this.project = project;
			this.maxIssues = maxIssues;
		}

		void execute(String jql) {
			int startAt = 0;
			while (!limitReached()) {
				SearchPage page = search(jql, startAt);
				if (page.isEmpty()) {
					logger.debug("{}: empty page at offset {}, done", project, startAt);
					break;
				}

				for (SearchHit hit : page.hits()) {
					if (limitReached()) {
						break;
					}
					process(hit);
				}

				checkpointStore.flush();
				storedSinceFlush = 0;
				logger.info("{}: processed page at offset {} ({} of {} hits examined)", project, startAt, examined,
						page.total());

				if (!page.hasMore()) {
					break;
				}
				// Keyless results still occupy server offsets.
				startAt += page.returned();
			}
		}

		private SearchPage search(String jql, int startAt) {
			try {
				return restService.searchIssues(jql, startAt, properties.getPageSize());
			}
			catch (JiraApiException e) {
				throw new ProjectAbortedException("search failed at offset " + startAt + ": " + e.getMessage(), e);
			}
		}

		private void process(SearchHit hit) {
			examined++;
			String key = hit.key();

			if (checkpointStore.isProcessed(project, key)) {
				duplicates++;
				logger.debug("{}: {} already processed, skipping", project, key);
				return;
			}

			JsonNode json;
			try {
				json = restService.getIssue(key);
			}
			catch (JiraApiException e) {
				failedFetches++;
				logger.warn("{}: failed to fetch {} ({}), skipping: {}", project, key, e.getKind(), e.getMessage());
				return;
			}

			Issue issue;
			try {
				issue = issueParser.parse(json);
			}
			catch (IssueValidationException e) {
				if (properties.isValidationStrictMode()) {
					throw new ProjectAbortedException("validation failed in strict mode: " + e.getMessage(), e);
				}
				invalid++;
				logger.warn("{}: invalid issue skipped: {}", project, e.getMessage());
				return;
			}

			storeWithRetry(issue);
			checkpointStore.recordProcessed(project, key);
			checkpointStore.advanceWatermark(project, issue.updated());
			stored++;
			storedSinceFlush++;
			logger.debug("{}: stored {} (updated {})", project, key, issue.updated());

			if (storedSinceFlush >= properties.getCheckpointInterval()) {
				checkpointStore.flush();
				storedSinceFlush = 0;
			}
		}

		private void storeWithRetry(Issue issue) {
			try {
				rawRecordStore.store(issue);
			}
			catch (StorageException first) {
				logger.warn("{}: storing {} failed, retrying once: {}", project, issue.key(), first.getMessage());
				try {
					rawRecordStore.store(issue);
				}
				catch (StorageException second) {
					throw new ProjectAbortedException(
							"raw store failed twice for " + issue.key() + ": " + second.getMessage(), second);
				}
			}
		}

		private boolean limitReached() {
			return maxIssues != null && examined >= maxIssues;
		}

	}

	/**
	 * Ends the current project; the run continues with the next one.
	 */
	static class ProjectAbortedException extends RuntimeException {

		ProjectAbortedException(String message, Throwable cause) {
			super(message, cause);
		}

	}

}
