package de.kherud.upscale.tiling;

import de.kherud.upscale.UpscaleException;

import java.util.List;

import static java.lang.System.Logger.Level.INFO;

/**
 * Runs additional detail passes over already enhanced tiles without changing their resolution.
 *
 * Pass 1 is the initial enhancement done by the scheduler; passes {@code 2..passCount} re-submit
 * every tile's current buffer through the same scheduler at upscale factor 1. Decomposition and
 * merging are not repeated.
 */
public class MultiPassRefiner {

	private static final System.Logger LOGGER = System.getLogger(MultiPassRefiner.class.getName());

	private final TileScheduler scheduler;

	public MultiPassRefiner(TileScheduler scheduler) {
		if (scheduler == null) {
			throw new IllegalArgumentException("Scheduler cannot be null");
		}
		this.scheduler = scheduler;
	}

	/**
	 * @param tiles output of the first enhancement pass
	 * @param passCount total number of passes including the first one
	 * @param prompt base prompt; each pass appends its own refinement instruction
	 * @return tiles after the last pass, in input order
	 * @throws UpscaleException with {@code INVALID_PARAMETER} if {@code passCount < 1}
	 */
	public List<EnhancedTile> refine(List<EnhancedTile> tiles, int passCount, String prompt) {
		if (passCount < 1) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_PARAMETER,
				"Pass count must be at least 1, got " + passCount);
		}
		List<EnhancedTile> current = tiles;
		for (int pass = 2; pass <= passCount; pass++) {
			LOGGER.log(INFO, String.format("Running enhancement pass %d/%d", pass, passCount));
			current = scheduler.refineAll(current, passPrompt(prompt, pass));
		}
		return current;
	}

	static String passPrompt(String prompt, int pass) {
		return prompt + ". Pass " + pass + ": Refine details further, enhance micro-textures, increase clarity.";
	}
}
