package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemCheckpointStore}.
 */
@DisplayName("FileSystemCheckpointStore Tests")
class FileSystemCheckpointStoreTest {

	private static final Instant T1 = Instant.parse("2024-01-15T10:30:00Z");

	private static final Instant T2 = Instant.parse("2024-02-01T00:00:00Z");

	@TempDir
	Path stateDir;

	private FileSystemCheckpointStore store;

	@BeforeEach
	void setUp() {
		store = new FileSystemCheckpointStore(stateDir, TestIssues.MAPPER);
	}

	private FileSystemCheckpointStore reopen() {
		return new FileSystemCheckpointStore(stateDir, TestIssues.MAPPER);
	}

	@Nested
	@DisplayName("Load Tests")
	class LoadTest {

		@Test
		@DisplayName("Should return the zero value when no checkpoint exists")
		void shouldReturnEmptyWhenMissing() {
			Checkpoint checkpoint = store.load("KAFKA");

			assertThat(checkpoint).isEqualTo(Checkpoint.empty("KAFKA"));
			assertThat(checkpoint.lastUpdateTimestamp()).isEqualTo(Instant.EPOCH);
			assertThat(checkpoint.processedKeys()).isEmpty();
		}

		@Test
		@DisplayName("Should treat a corrupt checkpoint as absent")
		void shouldTreatCorruptFileAsAbsent() throws IOException {
			Files.writeString(stateDir.resolve("KAFKA.json"), "{\"project\": \"KAFKA\", \"processed_ke",
					StandardCharsets.UTF_8);

			assertThat(store.load("KAFKA")).isEqualTo(Checkpoint.empty("KAFKA"));
		}

		@Test
		@DisplayName("Should ignore a leftover temporary file")
		void shouldIgnoreLeftoverTemporaryFile() throws IOException {
			store.recordProcessed("KAFKA", "KAFKA-1");
			store.flush();
			Files.writeString(stateDir.resolve("KAFKA.json.tmp"), "garbage", StandardCharsets.UTF_8);

			assertThat(reopen().load("KAFKA").processedKeys()).containsExactly("KAFKA-1");
		}

		@Test
		@DisplayName("Should reject project names that are not plain file names")
		void shouldRejectUnsafeProjectName() {
			assertThatThrownBy(() -> store.load("../outside")).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Mutation Tests")
	class MutationTest {

		@Test
		@DisplayName("Should record keys idempotently")
		void shouldRecordKeysIdempotently() {
			store.recordProcessed("KAFKA", "KAFKA-1");
			store.recordProcessed("KAFKA", "KAFKA-1");
			store.recordProcessed("KAFKA", "KAFKA-2");

			assertThat(store.load("KAFKA").processedKeys()).containsExactlyInAnyOrder("KAFKA-1", "KAFKA-2");
			assertThat(store.isProcessed("KAFKA", "KAFKA-1")).isTrue();
			assertThat(store.isProcessed("KAFKA", "KAFKA-3")).isFalse();
		}

		@Test
		@DisplayName("Should only move the watermark forward")
		void shouldAdvanceWatermarkMonotonically() {
			store.advanceWatermark("KAFKA", T2);
			store.advanceWatermark("KAFKA", T1);

			assertThat(store.load("KAFKA").lastUpdateTimestamp()).isEqualTo(T2);
		}

		@Test
		@DisplayName("Should keep projects independent")
		void shouldKeepProjectsIndependent() {
			store.recordProcessed("KAFKA", "KAFKA-1");
			store.advanceWatermark("SPARK", T1);

			assertThat(store.load("KAFKA").lastUpdateTimestamp()).isEqualTo(Instant.EPOCH);
			assertThat(store.load("SPARK").processedKeys()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Flush Tests")
	class FlushTest {

		@Test
		@DisplayName("Should persist state that survives a restart")
		void shouldPersistAcrossInstances() {
			store.recordProcessed("KAFKA", "KAFKA-2");
			store.recordProcessed("KAFKA", "KAFKA-1");
			store.advanceWatermark("KAFKA", T1);
			store.flush();

			Checkpoint reloaded = reopen().load("KAFKA");

			assertThat(reloaded.lastUpdateTimestamp()).isEqualTo(T1);
			assertThat(reloaded.processedKeys()).containsExactlyInAnyOrder("KAFKA-1", "KAFKA-2");
		}

		@Test
		@DisplayName("Should write snake_case JSON with sorted keys")
		void shouldWriteReadableJson() throws IOException {
			store.recordProcessed("KAFKA", "KAFKA-2");
			store.recordProcessed("KAFKA", "KAFKA-10");
			store.advanceWatermark("KAFKA", T1);
			store.flush();

			JsonNode json = TestIssues.MAPPER.readTree(stateDir.resolve("KAFKA.json").toFile());

			assertThat(json.path("project").asText()).isEqualTo("KAFKA");
			assertThat(json.path("last_update_timestamp").asText()).isEqualTo("2024-01-15T10:30:00Z");
			assertThat(json.path("processed_keys")).extracting(JsonNode::asText).containsExactly("KAFKA-10", "KAFKA-2");
			assertThat(stateDir.resolve("KAFKA.json.tmp")).doesNotExist();
		}

		@Test
		@DisplayName("Should not touch files of unchanged projects")
		void shouldOnlyFlushDirtyProjects() throws IOException {
			store.recordProcessed("KAFKA", "KAFKA-1");
			store.advanceWatermark("KAFKA", T1);
			store.flush();

			FileSystemCheckpointStore second = reopen();
			second.recordProcessed("KAFKA", "KAFKA-1");
			second.advanceWatermark("KAFKA", T1);
			second.load("SPARK");
			Path file = stateDir.resolve("KAFKA.json");
			Files.delete(file);
			second.flush();

			assertThat(file).doesNotExist();
			assertThat(stateDir.resolve("SPARK.json")).doesNotExist();
		}

		@Test
		@DisplayName("Should be safe to flush repeatedly")
		void shouldAllowRepeatedFlush() {
			store.recordProcessed("KAFKA", "KAFKA-1");
			store.flush();
			store.flush();

			assertThat(reopen().load("KAFKA").processedKeys()).containsExactly("KAFKA-1");
		}

		@Test
		@DisplayName("Should keep the previous checkpoint when a write is interrupted")
		void shouldSurviveCrashDuringWrite() {
			store.recordProcessed("KAFKA", "KAFKA-1");
			store.advanceWatermark("KAFKA", T1);
			store.flush();

			FileSystemCheckpointStore crashing = new FileSystemCheckpointStore(stateDir, TestIssues.MAPPER) {
				@Override
				protected void writeTemporary(Path tmp, byte[] content) throws IOException {
					// Half of the new content reaches the disk before the process dies.
					Files.write(tmp, java.util.Arrays.copyOf(content, content.length / 2));
					throw new IOException("simulated crash");
				}
			};
			crashing.recordProcessed("KAFKA", "KAFKA-2");
			crashing.advanceWatermark("KAFKA", T2);

			assertThatThrownBy(crashing::flush).isInstanceOf(StorageException.class)
				.hasMessageContaining("KAFKA")
				.hasCauseInstanceOf(IOException.class);

			Checkpoint survived = reopen().load("KAFKA");
			assertThat(survived.lastUpdateTimestamp()).isEqualTo(T1);
			assertThat(survived.processedKeys()).containsExactly("KAFKA-1");
		}

	}

}
