package me.go_gradually.callflow.domain.speech;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates streamed text deltas and releases fragments as soon as a sentence is complete.
 * Not thread-safe; owned by a single content stream.
 */
public final class SentenceBuffer {
    private final SentenceSegmenter segmenter;
    private final StringBuilder pending = new StringBuilder();

    public SentenceBuffer(SentenceSegmenter segmenter) {
        this.segmenter = segmenter;
    }

    public List<String> append(String delta) {
        if (delta == null || delta.isEmpty()) {
            return List.of();
        }
        pending.append(delta);
        int boundary = segmenter.lastCompleteBoundary(pending);
        if (boundary < 0) {
            if (pending.length() > segmenter.maxFragmentChars() * 2) {
                return drainAll();
            }
            return List.of();
        }
        String complete = pending.substring(0, boundary);
        pending.delete(0, boundary);
        return segmenter.segment(complete);
    }

    public List<String> flush() {
        return drainAll();
    }

    private List<String> drainAll() {
        String rest = pending.toString();
        pending.setLength(0);
        return new ArrayList<>(segmenter.segment(rest));
    }
}
