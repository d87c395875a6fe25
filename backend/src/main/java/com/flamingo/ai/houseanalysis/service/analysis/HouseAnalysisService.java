package com.flamingo.ai.houseanalysis.service.analysis;

import com.flamingo.ai.houseanalysis.domain.model.Verdict;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for lease document analysis. */
public interface HouseAnalysisService {

  /**
   * Analyzes the uploaded documents and returns the lease risk verdict.
   *
   * <p>Validation, transform and asset-registration failures are thrown. A completion that times
   * out, fails in transport, or cannot be parsed yields {@link Verdict#FALLBACK} instead.
   *
   * @param files uploaded images and PDFs, in upload order
   * @return fully populated verdict
   */
  Verdict analyze(List<MultipartFile> files);
}
