package com.flamingo.ai.latexexport.service.latex.scan;

import com.flamingo.ai.latexexport.exception.MathReconstructionException;
import com.flamingo.ai.latexexport.exception.ReconstructionPhase;
import java.util.Map;

/**
 * Protected markup removed by {@link ProtectedRegionMasker}, keyed by the placeholder left in its
 * place.
 */
public record MaskedRegions(Map<String, String> regions) {

  public MaskedRegions {
    regions = Map.copyOf(regions);
  }

  public int count() {
    return regions.size();
  }

  /**
   * Replaces every placeholder in {@code text} with the markup it stands for.
   *
   * @throws MathReconstructionException if a placeholder no longer occurs exactly once
   */
  public String restore(String text) {
    String restored = text;
    for (Map.Entry<String, String> region : regions.entrySet()) {
      String placeholder = region.getKey();
      int index = restored.indexOf(placeholder);
      if (index < 0 || restored.indexOf(placeholder, index + 1) >= 0) {
        throw new MathReconstructionException(
            ReconstructionPhase.POST_PROCESS,
            "Protected region placeholder " + placeholder + " lost during post-processing");
      }
      restored =
          restored.substring(0, index)
              + region.getValue()
              + restored.substring(index + placeholder.length());
    }
    return restored;
  }
}
