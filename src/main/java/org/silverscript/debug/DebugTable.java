package org.silverscript.debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The debug information of a compiled program: the mapped instructions in bytecode order and the
 * frames they belong to. Instructions without a mapping (dispatch, epilogue) have no entry.
 * <p>
 * Frame ids restart at 0 in every entrypoint, so frames are looked up by entrypoint and id.
 */
public final class DebugTable {

    private final List<DebugMapping> mappings;
    private final List<FrameInfo> frames;
    private final Map<Integer, DebugMapping> byOffset = new HashMap<>();
    private final Map<Integer, DebugMapping> bySequence = new HashMap<>();
    private final Map<String, Map<Integer, FrameInfo>> byFrame = new HashMap<>();

    /**
     * @param mappings Mappings in bytecode order.
     * @param frames All frames of the program.
     */
    public DebugTable(List<DebugMapping> mappings, List<FrameInfo> frames) {
        this.mappings = List.copyOf(mappings);
        this.frames = List.copyOf(frames);
        for (DebugMapping m : this.mappings) {
            if (byOffset.put(m.byteOffset(), m) != null) {
                throw new IllegalArgumentException("duplicate mapping at byte offset " + m.byteOffset());
            }
            if (bySequence.put(m.sequence(), m) != null) {
                throw new IllegalArgumentException("duplicate mapping sequence " + m.sequence());
            }
        }
        for (FrameInfo f : this.frames) {
            if (byFrame.computeIfAbsent(f.entrypoint(), k -> new HashMap<>()).put(f.frameId(), f) != null) {
                throw new IllegalArgumentException("duplicate frame " + f.frameId() + " in " + f.entrypoint());
            }
        }
    }

    public List<DebugMapping> mappings() {
        return mappings;
    }

    public List<FrameInfo> frames() {
        return frames;
    }

    public Optional<DebugMapping> mappingAt(int byteOffset) {
        return Optional.ofNullable(byOffset.get(byteOffset));
    }

    public Optional<DebugMapping> mappingForSequence(int sequence) {
        return Optional.ofNullable(bySequence.get(sequence));
    }

    public Optional<FrameInfo> frame(String entrypoint, int frameId) {
        return Optional.ofNullable(byFrame.getOrDefault(entrypoint, Map.of()).get(frameId));
    }

    /**
     * Walks the calling frames of a frame.
     * @param entrypoint The entrypoint owning the frame.
     * @param frameId The innermost frame.
     * @return The frames from the entrypoint body down to {@code frameId}; empty for an unknown frame.
     */
    public List<FrameInfo> frameChain(String entrypoint, int frameId) {
        List<FrameInfo> chain = new ArrayList<>();
        Optional<FrameInfo> current = frame(entrypoint, frameId);
        while (current.isPresent()) {
            chain.add(current.get());
            Integer parent = current.get().parentFrameId();
            current = parent == null ? Optional.empty() : frame(entrypoint, parent);
        }
        Collections.reverse(chain);
        return chain;
    }
}
