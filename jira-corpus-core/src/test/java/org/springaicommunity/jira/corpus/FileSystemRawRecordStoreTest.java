package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRawRecordStore}.
 */
@DisplayName("FileSystemRawRecordStore Tests")
class FileSystemRawRecordStoreTest {

	@TempDir
	Path rawDir;

	private FileSystemRawRecordStore store;

	@BeforeEach
	void setUp() {
		store = new FileSystemRawRecordStore(rawDir, TestIssues.MAPPER);
	}

	@Test
	@DisplayName("Should write one file per issue under the project directory")
	void shouldWriteRecordFile() throws IOException {
		Issue issue = TestIssues.issue("KAFKA-1", "Title", "Body",
				List.of(TestIssues.comment("1", "Looks good", "2024-01-11T00:00:00Z")));

		String location = store.store(issue);

		Path file = rawDir.resolve("KAFKA").resolve("KAFKA-1.json");
		assertThat(location).isEqualTo(file.toString());
		JsonNode json = TestIssues.MAPPER.readTree(file.toFile());
		assertThat(json.path("key").asText()).isEqualTo("KAFKA-1");
		assertThat(json.path("issue_type").asText()).isEqualTo("Bug");
		assertThat(json.path("resolution_date").asText()).isEqualTo("2024-01-11T07:53:20Z");
		assertThat(json.path("comments").get(0).path("body").asText()).isEqualTo("Looks good");
		assertThat(Files.list(file.getParent())).containsExactly(file);
	}

	@Test
	@DisplayName("Should read back an equal issue")
	void shouldRoundTripIssue() throws IOException {
		Issue issue = TestIssues.issue("SPARK-9", "Title", null, List.of());
		store.store(issue);

		Issue read = TestIssues.MAPPER.readValue(rawDir.resolve("SPARK/SPARK-9.json").toFile(), Issue.class);

		assertThat(read).isEqualTo(issue);
	}

	@Test
	@DisplayName("Should overwrite the previous record of the same key")
	void shouldOverwriteSameKey() throws IOException {
		store.store(TestIssues.issue("KAFKA-1", Instant.parse("2024-01-01T00:00:00Z")));
		store.store(TestIssues.issue("KAFKA-1", Instant.parse("2024-02-01T00:00:00Z")));

		JsonNode json = TestIssues.MAPPER.readTree(rawDir.resolve("KAFKA/KAFKA-1.json").toFile());
		assertThat(json.path("updated").asText()).isEqualTo("2024-02-01T00:00:00Z");
	}

	@Test
	@DisplayName("Should wrap write failures in StorageException")
	void shouldWrapWriteFailures() throws IOException {
		Files.writeString(rawDir.resolve("KAFKA"), "a file where the project directory should be");

		assertThatThrownBy(() -> store.store(TestIssues.issue("KAFKA-1", Instant.now())))
			.isInstanceOf(StorageException.class)
			.hasMessageContaining("KAFKA-1");
	}

}
