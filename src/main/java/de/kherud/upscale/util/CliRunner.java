package de.kherud.upscale.util;

import de.kherud.upscale.UpscaleException;

/**
 * Runs command line entry points so that {@code main} stays a thin wrapper and the
 * command itself can be called from tests without terminating the JVM.
 *
 * Exit code 1 means the caller's input was rejected (bad arguments, bad parameters, unreadable
 * image, too many tiles); exit code 2 means the run itself failed.
 */
public final class CliRunner {

	public static final int EXIT_OK = 0;
	public static final int EXIT_USAGE = 1;
	public static final int EXIT_FAILURE = 2;

	@FunctionalInterface
	public interface CliApplication {
		void run(String[] args) throws Exception;
	}

	private CliRunner() {
		throw new AssertionError("Utility class should not be instantiated");
	}

	public static void runWithExit(CliApplication app, String[] args) {
		int code = runWithoutExit(app, args);
		if (code != EXIT_OK) {
			System.exit(code);
		}
	}

	/**
	 * @return {@link #EXIT_OK}, {@link #EXIT_USAGE} or {@link #EXIT_FAILURE}
	 */
	public static int runWithoutExit(CliApplication app, String[] args) {
		try {
			app.run(args);
			return EXIT_OK;
		} catch (IllegalArgumentException e) {
			System.err.println("Error: " + e.getMessage());
			return EXIT_USAGE;
		} catch (UpscaleException e) {
			System.err.println("Error [" + e.getKind().getCode() + "]: " + e.getMessage());
			return isCallerError(e.getKind()) ? EXIT_USAGE : EXIT_FAILURE;
		} catch (Exception e) {
			System.err.println("Fatal error: " + e.getMessage());
			e.printStackTrace();
			return EXIT_FAILURE;
		}
	}

	static boolean isCallerError(UpscaleException.ErrorKind kind) {
		switch (kind) {
			case INVALID_PARAMETER:
			case INVALID_IMAGE:
			case TILE_LIMIT_EXCEEDED:
				return true;
			default:
				return false;
		}
	}
}
