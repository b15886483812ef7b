package com.streameast.captcha.font;

import java.util.Optional;

public interface FontSource {

    String describe();

    Optional<GlyphFace> load();
}
