package com.flamingo.ai.houseanalysis.service.analysis;

import com.flamingo.ai.houseanalysis.domain.model.AssetReference;
import com.flamingo.ai.houseanalysis.domain.model.InferenceOutcome;
import com.flamingo.ai.houseanalysis.domain.model.InferenceRequest;
import com.flamingo.ai.houseanalysis.domain.model.Page;
import com.flamingo.ai.houseanalysis.domain.model.SourceDocument;
import com.flamingo.ai.houseanalysis.domain.model.Verdict;
import com.flamingo.ai.houseanalysis.domain.model.VisualAsset;
import com.flamingo.ai.houseanalysis.exception.DocumentValidationException;
import com.flamingo.ai.houseanalysis.service.analysis.asset.AssetRegistrar;
import com.flamingo.ai.houseanalysis.service.analysis.extraction.VerdictExtractor;
import com.flamingo.ai.houseanalysis.service.analysis.inference.BoundedInferenceInvoker;
import com.flamingo.ai.houseanalysis.service.analysis.intake.IntakeClassifier;
import com.flamingo.ai.houseanalysis.service.analysis.prompt.PromptAssembler;
import com.flamingo.ai.houseanalysis.service.analysis.render.PdfRasterizer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Runs the analysis pipeline: intake, rasterization, asset registration, prompt assembly, bounded
 * completion and verdict extraction.
 *
 * <p>Every upload is classified and rendered before the first asset is registered, so a bad file
 * anywhere in the request fails it without touching the inference service. The pipeline keeps no
 * state between calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HouseAnalysisServiceImpl implements HouseAnalysisService {

  private final IntakeClassifier intakeClassifier;
  private final PdfRasterizer pdfRasterizer;
  private final AssetRegistrar assetRegistrar;
  private final PromptAssembler promptAssembler;
  private final BoundedInferenceInvoker inferenceInvoker;
  private final VerdictExtractor verdictExtractor;
  private final FallbackVerdictPolicy fallbackVerdictPolicy;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "analysis.total", description = "Time to analyze an upload")
  public Verdict analyze(List<MultipartFile> files) {
    if (files == null || files.isEmpty()) {
      throw new DocumentValidationException("At least one file is required.");
    }
    log.info("Analyzing {} uploaded file(s)", files.size());

    List<SourceDocument> documents = classify(files);
    List<VisualAsset> assets = toVisualAssets(documents);
    List<AssetReference> references = assetRegistrar.registerAll(assets);
    InferenceRequest request = promptAssembler.assemble(references);
    InferenceOutcome outcome = inferenceInvoker.invoke(request);

    return resolve(outcome);
  }

  private List<SourceDocument> classify(List<MultipartFile> files) {
    List<SourceDocument> documents = new ArrayList<>(files.size());
    for (int i = 0; i < files.size(); i++) {
      MultipartFile file = files.get(i);
      documents.add(intakeClassifier.classify(i, file.getOriginalFilename(), readBytes(file)));
    }
    return documents;
  }

  private List<VisualAsset> toVisualAssets(List<SourceDocument> documents) {
    List<VisualAsset> assets = new ArrayList<>();
    for (SourceDocument document : documents) {
      meterRegistry
          .counter("analysis.documents", "kind", document.kind().name().toLowerCase())
          .increment();
      if (document.isPdf()) {
        for (Page page : pdfRasterizer.rasterize(document)) {
          assets.add(VisualAsset.ofPage(document, page));
        }
      } else {
        assets.add(VisualAsset.ofImage(document));
      }
    }
    log.debug("{} document(s) expanded to {} visual asset(s)", documents.size(), assets.size());
    return assets;
  }

  private Verdict resolve(InferenceOutcome outcome) {
    if (outcome instanceof InferenceOutcome.Success success) {
      Optional<Verdict> verdict = verdictExtractor.extract(success.rawText());
      if (verdict.isPresent()) {
        meterRegistry.counter("analysis.verdict", "source", "model", "reason", "none").increment();
        log.info("Verdict extracted: {}", verdict.get());
        return verdict.get();
      }
      return fallbackVerdictPolicy.apply(
          FallbackReason.EXTRACTION_FAILED, "model output did not yield a valid verdict");
    }
    if (outcome instanceof InferenceOutcome.TimedOut timedOut) {
      return fallbackVerdictPolicy.apply(
          FallbackReason.TIMED_OUT, "no answer within " + timedOut.deadline().toSeconds() + "s");
    }
    InferenceOutcome.UpstreamFailure failure = (InferenceOutcome.UpstreamFailure) outcome;
    return fallbackVerdictPolicy.apply(FallbackReason.UPSTREAM_FAILURE, failure.reason());
  }

  private byte[] readBytes(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      log.error("Failed to read upload {}: {}", file.getOriginalFilename(), e.getMessage());
      throw new DocumentValidationException(
          file.getOriginalFilename(), "Failed to read file content: " + file.getOriginalFilename());
    }
  }
}
