package org.springaicommunity.jira.corpus.cli;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Variable lookup backed by {@code .env} files and the process environment.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>process environment</li>
 * <li>{@code .env} in the working directory (if present)</li>
 * <li>{@code .env} in the home directory (if present)</li>
 * </ol>
 * Missing or malformed files are ignored.
 */
public final class EnvironmentSupport {

	private final Dotenv workingDirDotenv;

	@Nullable
	private final Dotenv homeDotenv;

	private EnvironmentSupport(Dotenv workingDirDotenv, @Nullable Dotenv homeDotenv) {
		this.workingDirDotenv = workingDirDotenv;
		this.homeDotenv = homeDotenv;
	}

	/**
	 * Lookup for the current working directory and {@code user.home}.
	 */
	public static EnvironmentSupport standard() {
		String home = System.getProperty("user.home");
		return forDirectories(Path.of(""), home != null ? Path.of(home) : null);
	}

	/**
	 * Lookup for explicit directories.
	 * @param workingDir directory holding the primary {@code .env}
	 * @param homeDir directory holding the fallback {@code .env}, or null for none
	 */
	public static EnvironmentSupport forDirectories(Path workingDir, @Nullable Path homeDir) {
		Dotenv home = homeDir != null && !homeDir.equals(workingDir) ? load(homeDir) : null;
		return new EnvironmentSupport(load(workingDir), home);
	}

	/**
	 * Get a variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public String get(String name) {
		// Dotenv.get consults the process environment before the file
		String value = workingDirDotenv.get(name);
		if (value == null && homeDotenv != null) {
			value = homeDotenv.get(name);
		}
		return value;
	}

	private static Dotenv load(Path directory) {
		return Dotenv.configure()
			.directory(directory.toAbsolutePath().toString())
			.ignoreIfMissing()
			.ignoreIfMalformed()
			.load();
	}

}
