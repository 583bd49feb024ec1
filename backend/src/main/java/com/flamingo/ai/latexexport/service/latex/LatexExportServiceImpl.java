package com.flamingo.ai.latexexport.service.latex;

import com.flamingo.ai.latexexport.config.LatexExportConfig;
import com.flamingo.ai.latexexport.service.latex.model.MathNode;
import com.flamingo.ai.latexexport.service.latex.model.ScanMode;
import com.flamingo.ai.latexexport.service.latex.nesting.InvalidNestingCleaner;
import com.flamingo.ai.latexexport.service.latex.preprocess.LatexContentCleaner;
import com.flamingo.ai.latexexport.service.latex.preprocess.LatexSyntaxValidator;
import com.flamingo.ai.latexexport.service.latex.preprocess.SyntaxValidationResult;
import com.flamingo.ai.latexexport.service.latex.replace.MarkAndReplaceEngine;
import com.flamingo.ai.latexexport.service.latex.replace.MarkResult;
import com.flamingo.ai.latexexport.service.latex.scan.ExportWorkspace;
import com.flamingo.ai.latexexport.service.latex.scan.MaskedRegions;
import com.flamingo.ai.latexexport.service.latex.scan.MathNodeScanner;
import com.flamingo.ai.latexexport.service.latex.scan.ProtectedRegionMasker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Pipeline orchestrator: validate, clean, scan, mark, commit, strip artifacts, repair nesting.
 *
 * <p>Everything after validation runs inside one try block; any failure there returns the caller's
 * original content and the workspace is closed either way. Artifact stripping and nesting repair
 * work on the serialized text with protected regions masked out, so those regions come back
 * unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LatexExportServiceImpl implements LatexExportService {

  private final LatexSyntaxValidator syntaxValidator;
  private final LatexContentCleaner contentCleaner;
  private final MathNodeScanner nodeScanner;
  private final MarkAndReplaceEngine markAndReplaceEngine;
  private final InvalidNestingCleaner nestingCleaner;
  private final ProtectedRegionMasker protectedRegionMasker;
  private final LatexExportConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "latex.export.process", description = "Time to reconstruct LaTeX for export")
  public String process(String content) {
    return processWithReport(content, null).content();
  }

  @Override
  @Timed(value = "latex.export.process", description = "Time to reconstruct LaTeX for export")
  public String process(String content, Element liveTree) {
    return processWithReport(content, liveTree).content();
  }

  @Override
  @Timed(value = "latex.export.process", description = "Time to reconstruct LaTeX for export")
  public ExportResult processWithReport(String content, Element liveTree) {
    String input = content != null ? content : "";
    String runId = UUID.randomUUID().toString().substring(0, 8);
    log.info("Starting LaTeX reconstruction run {} ({} chars)", runId, input.length());

    SyntaxValidationResult validation = syntaxValidator.validate(input);

    ScanMode mode = ScanMode.STATIC;
    String output;
    List<MathNode> nodes;
    MarkResult markResult;
    int committed;
    boolean nestingRepaired;
    try {
      Element liveOutput = findLiveOutput(liveTree);
      mode = liveOutput != null ? ScanMode.LIVE : ScanMode.STATIC;
      String cleaned = contentCleaner.clean(input);
      MaskedRegions masked;
      try (ExportWorkspace workspace = openWorkspace(mode, cleaned, liveOutput, runId)) {
        nodes = nodeScanner.scan(workspace);
        markResult = markAndReplaceEngine.mark(nodes, runId);
        committed = markAndReplaceEngine.commit(workspace, markResult);
        masked = protectedRegionMasker.mask(workspace, runId);
        output = workspace.serialize();
      }
      if (config.getArtifacts().isStripEnabled()) {
        output = contentCleaner.stripTypesetterArtifacts(output);
      }
      nestingRepaired =
          config.getNesting().isCleanEnabled() && nestingCleaner.detectInvalidNesting(output);
      if (nestingRepaired) {
        output = nestingCleaner.cleanInvalidNesting(output);
      }
      output = masked.restore(output);
    } catch (RuntimeException e) {
      log.error(
          "LaTeX reconstruction run {} failed, returning original content: {}",
          runId,
          e.getMessage(),
          e);
      meterRegistry.counter("latex.export.rollbacks").increment();
      return new ExportResult(content, ExportReport.rolledBack(mode, validation.issues()));
    }

    if (nestingRepaired) {
      meterRegistry.counter("latex.export.nesting.repaired").increment();
    }
    meterRegistry.counter("latex.export.replacements").increment(committed);
    meterRegistry
        .counter("latex.export.semantic.fallbacks")
        .increment(markResult.semanticFallbacks());

    ExportReport report =
        new ExportReport(
            mode,
            nodes.size(),
            committed,
            markResult.semanticFallbacks(),
            markResult.unconvertible(),
            validation.issues(),
            nestingRepaired,
            false);
    log.info(
        "Run {} converted {} of {} math expressions ({} mode, {} semantic fallbacks,"
            + " {} left as-is); {} -> {} chars",
        runId,
        committed,
        nodes.size(),
        mode,
        report.semanticFallbacks(),
        report.unconvertible(),
        input.length(),
        output.length());
    return new ExportResult(output, report);
  }

  private Element findLiveOutput(Element liveTree) {
    if (liveTree == null) {
      return null;
    }
    Element liveOutput = liveTree.selectFirst(config.getScan().getLiveTreeSelector());
    if (liveOutput == null) {
      log.warn(
          "Live tree supplied but '{}' not found in it, parsing content instead",
          config.getScan().getLiveTreeSelector());
      return null;
    }
    log.info("Using live tree for extraction (preserves order in large documents)");
    return liveOutput;
  }

  private ExportWorkspace openWorkspace(
      ScanMode mode, String cleaned, Element liveOutput, String runId) {
    return mode == ScanMode.LIVE
        ? ExportWorkspace.cloneOf(liveOutput, runId)
        : ExportWorkspace.parse(cleaned);
  }
}
