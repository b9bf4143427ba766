package com.phillippitts.audiogen.service.request;

import com.phillippitts.audiogen.domain.SynthesisRequest;

import java.util.List;

/**
 * Built-in catalog used when no requests file is configured.
 */
public class SampleRequestSource implements RequestSource {

    static final String SPEAKER = "Joanna";

    private static final String DISCOVERY = "The path to discovery is rarely a straight line. "
            + "Throughout history, explorers have ventured into the unknown, driven by an unyielding "
            + "curiosity and a desire to uncover the secrets of our world. From the icy tundras of the "
            + "North to the vast deserts of the Sahara, each journey held the promise of wonder, danger, "
            + "and knowledge. And while their paths were fraught with challenges, each step brought new "
            + "insights that reshaped our understanding of the Earth and the cosmos beyond.";

    private static final String NATURE = "The natural world is a delicate web of interconnected life, "
            + "each species playing a vital role in the ecosystem. From the towering trees of the "
            + "rainforest to the coral reefs teeming with colorful fish, our planet is a masterpiece of "
            + "biodiversity. However, human activity has strained this balance, leading to habitat "
            + "destruction, climate change, and species extinction. Conservation efforts are essential "
            + "to preserving this fragile balance, ensuring that future generations can experience the "
            + "awe and beauty of the world as we know it today.";

    @Override
    public List<SynthesisRequest> load() {
        return List.of(
                new SynthesisRequest("1", SPEAKER, DISCOVERY),
                new SynthesisRequest("2", SPEAKER, NATURE)
        );
    }

    @Override
    public String describe() {
        return "built-in sample";
    }
}
