package com.streameast.captcha.font;

import com.streameast.captcha.util.PixelMath;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FontResolverTest {

    @Test
    void firstAvailableSourceWins() {
        GlyphFace chosen = mock(GlyphFace.class);
        FontSource missing = mock(FontSource.class);
        FontSource available = mock(FontSource.class);
        FontSource unused = mock(FontSource.class);
        when(missing.load()).thenReturn(Optional.empty());
        when(available.load()).thenReturn(Optional.of(chosen));

        FontResolver resolver = new FontResolver(List.of(missing, available, unused));

        assertThat(resolver.getDefaultFace()).isSameAs(chosen);
        verify(unused, never()).load();
    }

    @Test
    void missingFilesFallThroughToBuiltinFace() {
        FontResolver resolver = FontResolver.create("/no/such/preferred.ttf",
                List.of("/no/such/first.ttf", "", "/no/such/second.ttf"), false);

        assertThat(resolver.getDefaultFace()).isSameAs(BuiltinGlyphFace.INSTANCE);
        assertThat(resolver.describeChain()).containsExactly(
                "file:/no/such/preferred.ttf",
                "file:/no/such/first.ttf",
                "file:/no/such/second.ttf",
                "builtin");
    }

    @Test
    void unresolvableRequestPathUsesDefaultFace() {
        FontResolver resolver = new FontResolver(List.of(new BuiltinFontSource()));

        assertThat(resolver.resolve(null)).isSameAs(BuiltinGlyphFace.INSTANCE);
        assertThat(resolver.resolve("  ")).isSameAs(BuiltinGlyphFace.INSTANCE);
        assertThat(resolver.resolve("/definitely/not/a/font.ttf")).isSameAs(BuiltinGlyphFace.INSTANCE);
    }

    @Test
    void emptyChainStillYieldsBuiltinFace() {
        assertThat(new FontResolver(List.of()).getDefaultFace()).isSameAs(BuiltinGlyphFace.INSTANCE);
    }

    @Test
    void fileSourceRejectsNonFontFile(@TempDir Path dir) throws Exception {
        File notAFont = dir.resolve("not-a-font.ttf").toFile();
        FileUtils.writeStringToFile(notAFont, "plain text", StandardCharsets.UTF_8);

        assertThat(new FileFontSource(notAFont.getPath()).load()).isEmpty();
    }

    @Test
    void bareFileNameIsFoundInFontDirectories(@TempDir Path dir) throws Exception {
        File nested = dir.resolve("truetype/vendor/Arial.TTF").toFile();
        FileUtils.writeStringToFile(nested, "glyph data", StandardCharsets.UTF_8);

        FileFontSource source = new FileFontSource("arial.ttf", List.of(dir.resolve("missing").toFile(), dir.toFile()));

        assertThat(source.locate()).contains(nested);
    }

    @Test
    void pathsWithDirectoriesAreNotSearched(@TempDir Path dir) throws Exception {
        FileUtils.writeStringToFile(dir.resolve("fonts/sans.ttf").toFile(), "glyph data", StandardCharsets.UTF_8);

        assertThat(new FileFontSource("/no/such/sans.ttf", List.of(dir.toFile())).locate()).isEmpty();
        assertThat(new FileFontSource("other/sans.ttf", List.of(dir.toFile())).locate()).isEmpty();
    }

    @Test
    void platformFontDirectoriesAreFontFolders() {
        assertThat(FileFontSource.systemFontDirectories()).isNotEmpty();
        assertThat(FileFontSource.systemFontDirectories()).allMatch(directory -> directory.getPath().toLowerCase().contains("fonts"));
    }

    @Test
    void builtinFaceSkipsWhitespace() {
        assertThat(inkOf('5')).isPositive();
        assertThat(inkOf('x')).isPositive();
        assertThat(inkOf('#')).isPositive();
        assertThat(inkOf(' ')).isZero();
    }

    private static int inkOf(char ch) {
        BufferedImage canvas = new BufferedImage(40, 50, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(Color.BLACK);
            BuiltinGlyphFace.INSTANCE.drawGlyph(g, ch, 4, 8, 30);
        } finally {
            g.dispose();
        }
        int ink = 0;
        for (int y = 0; y < 50; y++) {
            for (int x = 0; x < 40; x++) {
                if (PixelMath.alpha(canvas.getRGB(x, y)) > 0) {
                    ink++;
                }
            }
        }
        return ink;
    }
}
