package com.hazardscan.core.detect;

import java.util.List;

/**
 * Pre-check result for one input variable that feeds a NOT gate directly.
 *
 * @param directNotGates    NOT gates driven straight from the variable
 * @param originalPaths     variable paths that leave it through a non-NOT gate
 * @param negatedPaths      variable paths that leave it through one of {@code directNotGates}
 * @param convergencePoints gates on both kinds of path, in topological order
 */
public record HazardCandidate(
    String variableId,
    String variableName,
    List<String> directNotGates,
    List<List<String>> originalPaths,
    List<List<String>> negatedPaths,
    List<String> convergencePoints
) {
    public boolean hasConvergence() {
        return !convergencePoints.isEmpty();
    }
}
