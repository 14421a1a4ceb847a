package com.flamingo.ai.pdfchat.service.rag.model;

/**
 * Per-signal scores behind a fused score. Raw scores are {@code null} when the chunk was not
 * returned by that signal; its normalized score is then 0.
 */
public record SignalBreakdown(
    Double vectorRaw, double vectorNormalized, Double keywordRaw, double keywordNormalized) {}
