package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Builder for creating ingestion and transform services.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults: public Apache Jira, data/raw and data/state
 * IngestionService ingestion = JiraCorpusBuilder.create().buildIngestionService();
 * IngestionResult result = ingestion.ingest(new IngestionRequest(List.of("KAFKA"), null, 100));
 *
 * // With custom configuration
 * CorpusProperties props = new CorpusProperties();
 * props.setRawDir("/var/jira/raw");
 * props.setRequestDelayMs(1000);
 *
 * TransformPipeline transform = JiraCorpusBuilder.create()
 *     .properties(props)
 *     .buildTransformPipeline();
 *
 * // For testing with a mock transport
 * JiraClient mockClient = mock(JiraClient.class);
 * IngestionService testIngestion = JiraCorpusBuilder.create()
 *     .jiraClient(mockClient)
 *     .buildIngestionService();
 * }
 * </pre>
 */
public class JiraCorpusBuilder {

	private CorpusProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private JiraClient jiraClient;

	@Nullable
	private Sleeper sleeper;

	@Nullable
	private CheckpointStore checkpointStore;

	@Nullable
	private RawRecordStore rawRecordStore;

	@Nullable
	private IssueTypeClassifier issueTypeClassifier;

	@Nullable
	private ResolutionExtractor resolutionExtractor;

	private JiraCorpusBuilder() {
		this.properties = new CorpusProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new JiraCorpusBuilder
	 */
	public static JiraCorpusBuilder create() {
		return new JiraCorpusBuilder();
	}

	/**
	 * Set corpus properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public JiraCorpusBuilder properties(@Nullable CorpusProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use {@link ObjectMapperFactory})
	 * @return this builder
	 */
	public JiraCorpusBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom transport. The client is still wrapped with retry and pacing, so tests
	 * usually pair it with {@link #sleeper(Sleeper)}.
	 * @param jiraClient custom JiraClient implementation (null to use
	 * {@link JiraHttpClient})
	 * @return this builder
	 */
	public JiraCorpusBuilder jiraClient(@Nullable JiraClient jiraClient) {
		this.jiraClient = jiraClient;
		return this;
	}

	/**
	 * Set the sleeper used for retry backoff and request pacing.
	 * @param sleeper custom Sleeper (null to use {@link Sleeper#SYSTEM})
	 * @return this builder
	 */
	public JiraCorpusBuilder sleeper(@Nullable Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Set a custom CheckpointStore implementation.
	 * @param checkpointStore custom store (null to use {@link FileSystemCheckpointStore}
	 * under {@link CorpusProperties#getStateDir()})
	 * @return this builder
	 */
	public JiraCorpusBuilder checkpointStore(@Nullable CheckpointStore checkpointStore) {
		this.checkpointStore = checkpointStore;
		return this;
	}

	/**
	 * Set a custom RawRecordStore implementation.
	 * @param rawRecordStore custom store (null to use {@link FileSystemRawRecordStore}
	 * under {@link CorpusProperties#getRawDir()})
	 * @return this builder
	 */
	public JiraCorpusBuilder rawRecordStore(@Nullable RawRecordStore rawRecordStore) {
		this.rawRecordStore = rawRecordStore;
		return this;
	}

	/**
	 * Set the type inference policy of the classification task.
	 * @param issueTypeClassifier custom classifier (null to use
	 * {@link KeywordIssueTypeClassifier})
	 * @return this builder
	 */
	public JiraCorpusBuilder issueTypeClassifier(@Nullable IssueTypeClassifier issueTypeClassifier) {
		this.issueTypeClassifier = issueTypeClassifier;
		return this;
	}

	/**
	 * Set the answer extraction policy of the Q&A task.
	 * @param resolutionExtractor custom extractor (null to use
	 * {@link KeywordResolutionExtractor})
	 * @return this builder
	 */
	public JiraCorpusBuilder resolutionExtractor(@Nullable ResolutionExtractor resolutionExtractor) {
		this.resolutionExtractor = resolutionExtractor;
		return this;
	}

	/**
	 * Build an IngestionService.
	 * @return configured IngestionService
	 */
	public IngestionService buildIngestionService() {
		Components components = buildComponents();
		CheckpointStore checkpoints = this.checkpointStore != null ? this.checkpointStore
				: new FileSystemCheckpointStore(Path.of(properties.getStateDir()), components.objectMapper);
		RawRecordStore rawStore = this.rawRecordStore != null ? this.rawRecordStore
				: new FileSystemRawRecordStore(Path.of(properties.getRawDir()), components.objectMapper);
		return new IngestionService(buildRestService(components), components.issueParser, checkpoints, rawStore,
				properties);
	}

	/**
	 * Build a TransformPipeline.
	 * @return configured TransformPipeline
	 */
	public TransformPipeline buildTransformPipeline() {
		Components components = buildComponents();
		IssueTypeClassifier classifier = this.issueTypeClassifier != null ? this.issueTypeClassifier
				: new KeywordIssueTypeClassifier();
		ResolutionExtractor extractor = this.resolutionExtractor != null ? this.resolutionExtractor
				: new KeywordResolutionExtractor();
		return new TransformPipeline(components.objectMapper, components.issueParser,
				new CorpusTaskBuilder(classifier, extractor));
	}

	/**
	 * Build the RestService directly (for advanced usage).
	 * @return configured RestService
	 */
	public RestService buildRestService() {
		return buildRestService(buildComponents());
	}

	private RestService buildRestService(Components components) {
		JiraClient transport = this.jiraClient != null ? this.jiraClient
				: new JiraHttpClient(properties.getBaseUrl(), components.objectMapper,
						Duration.ofSeconds(properties.getConnectTimeoutSeconds()),
						Duration.ofSeconds(properties.getRequestTimeoutSeconds()));

		JiraClient retrying = RetryingJiraClient.builder()
			.wrapping(transport)
			.maxAttempts(properties.getMaxAttempts())
			.baseDelay(Duration.ofMillis(properties.getRetryBaseDelayMs()))
			.maxDelay(Duration.ofMillis(properties.getRetryMaxDelayMs()))
			.requestDelay(Duration.ofMillis(properties.getRequestDelayMs()))
			.sleeper(this.sleeper != null ? this.sleeper : Sleeper.SYSTEM)
			.build();

		return new JiraRestService(retrying, components.jsonUtils, ZoneId.of(properties.getQueryZone()));
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		JsonNodeUtils jsonUtils = new JsonNodeUtils();
		return new Components(mapper, jsonUtils, new JiraIssueParser(jsonUtils));
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(ObjectMapper objectMapper, JsonNodeUtils jsonUtils, JiraIssueParser issueParser) {
	}

}
