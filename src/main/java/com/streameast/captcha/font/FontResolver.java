package com.streameast.captcha.font;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class FontResolver {

    private final List<FontSource> chain;
    private final GlyphFace defaultFace;
    private final Map<String, GlyphFace> explicitFaces = new ConcurrentHashMap<>();
    private final Set<String> unavailablePaths = ConcurrentHashMap.newKeySet();

    public FontResolver(List<FontSource> chain) {
        this.chain = List.copyOf(chain);
        this.defaultFace = firstAvailable(this.chain).orElse(BuiltinGlyphFace.INSTANCE);
        log.info("Default glyph face: {}", defaultFace.getName());
    }

    public static FontResolver create(String preferredPath, List<String> candidates, boolean useLogicalFonts) {
        List<FontSource> chain = new ArrayList<>();
        if (StringUtils.isNotBlank(preferredPath)) {
            chain.add(new FileFontSource(preferredPath));
        }
        if (candidates != null) {
            candidates.stream()
                    .filter(StringUtils::isNotBlank)
                    .map(FileFontSource::new)
                    .forEach(chain::add);
        }
        if (useLogicalFonts) {
            chain.add(new LogicalFontSource());
        }
        chain.add(new BuiltinFontSource());
        return new FontResolver(chain);
    }

    public GlyphFace getDefaultFace() {
        return defaultFace;
    }

    /**
     * Face for a per-request font path. Falls back to the default face when the path is blank or
     * cannot be loaded; never fails.
     */
    public GlyphFace resolve(String fontPath) {
        if (StringUtils.isBlank(fontPath)) {
            return defaultFace;
        }
        GlyphFace cached = explicitFaces.get(fontPath);
        if (cached != null) {
            return cached;
        }
        if (unavailablePaths.contains(fontPath)) {
            return defaultFace;
        }
        Optional<GlyphFace> loaded = new FileFontSource(fontPath).load();
        if (loaded.isEmpty()) {
            log.warn("Font {} could not be loaded, using {}", fontPath, defaultFace.getName());
            unavailablePaths.add(fontPath);
            return defaultFace;
        }
        explicitFaces.putIfAbsent(fontPath, loaded.get());
        return explicitFaces.get(fontPath);
    }

    public List<String> describeChain() {
        return chain.stream().map(FontSource::describe).toList();
    }

    private static Optional<GlyphFace> firstAvailable(List<FontSource> sources) {
        for (FontSource source : sources) {
            Optional<GlyphFace> face = source.load();
            if (face.isPresent()) {
                log.debug("Font source {} selected", source.describe());
                return face;
            }
            log.debug("Font source {} unavailable", source.describe());
        }
        return Optional.empty();
    }
}
