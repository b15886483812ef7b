package com.streameast.captcha.font;

import java.util.Optional;

public class BuiltinFontSource implements FontSource {

    @Override
    public String describe() {
        return "builtin";
    }

    @Override
    public Optional<GlyphFace> load() {
        return Optional.of(BuiltinGlyphFace.INSTANCE);
    }
}
