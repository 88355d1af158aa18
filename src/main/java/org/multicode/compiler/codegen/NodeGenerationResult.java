package org.multicode.compiler.codegen;

/**
 * Tells the traversal how to continue after a node generator ran.
 *
 * @param followExecutionFlow     Continue with the target of the node's {@code exec-out} port.
 * @param customExecutionHandling The generator traversed its successors itself.
 * @param continuationPort        For custom handling: an execution port whose target the
 *                                traversal continues with after the node's own code, or {@code null}.
 */
public record NodeGenerationResult(
		boolean followExecutionFlow,
		boolean customExecutionHandling,
		String continuationPort
) {
	private static final NodeGenerationResult FOLLOW = new NodeGenerationResult(true, false, null);
	private static final NodeGenerationResult STOP = new NodeGenerationResult(false, false, null);
	private static final NodeGenerationResult CUSTOM = new NodeGenerationResult(false, true, null);

	/** Continue with {@code exec-out}. */
	public static NodeGenerationResult follow() {
		return FOLLOW;
	}

	/** Terminal statement such as {@code return} or {@code break}. */
	public static NodeGenerationResult stop() {
		return STOP;
	}

	/** The generator handled all successors. */
	public static NodeGenerationResult custom() {
		return CUSTOM;
	}

	/**
	 * The generator handled its nested successors; the traversal continues with the target of
	 * the given port (e.g. a loop's {@code completed}).
	 */
	public static NodeGenerationResult customThen(String continuationPort) {
		return new NodeGenerationResult(false, true, continuationPort);
	}
}
