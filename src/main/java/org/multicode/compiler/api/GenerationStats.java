package org.multicode.compiler.api;

/**
 * Statistics of a single generation.
 *
 * @param nodesProcessed   Number of nodes visited by the execution traversal.
 * @param linesOfCode      Non-blank, non-comment lines of the generated file.
 * @param generationTimeMs Wall-clock duration of the call.
 */
public record GenerationStats(int nodesProcessed, int linesOfCode, long generationTimeMs) {
}
