package com.streameast.captcha.font;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOCase;
import org.apache.commons.io.filefilter.NameFileFilter;
import org.apache.commons.io.filefilter.TrueFileFilter;
import org.apache.commons.lang3.StringUtils;

import java.awt.Font;
import java.awt.FontFormatException;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Slf4j
public class FileFontSource implements FontSource {

    private final String path;
    private final List<File> fontDirectories;

    public FileFontSource(String path) {
        this(path, systemFontDirectories());
    }

    public FileFontSource(String path, List<File> fontDirectories) {
        this.path = path;
        this.fontDirectories = List.copyOf(fontDirectories);
    }

    @Override
    public String describe() {
        return "file:" + path;
    }

    @Override
    public Optional<GlyphFace> load() {
        Optional<File> located = locate();
        if (located.isEmpty()) {
            log.debug("Font candidate not found: {}", path);
            return Optional.empty();
        }
        File file = located.get();
        try {
            Font font = Font.createFont(Font.TRUETYPE_FONT, file);
            return Optional.of(new TrueTypeGlyphFace(font, file.getName()));
        } catch (IOException | FontFormatException e) {
            log.warn("Unable to load font {}: {}", file, e.getMessage());
        } catch (RuntimeException | LinkageError e) {
            log.warn("Font support unavailable while loading {}: {}", file, e.toString());
        }
        return Optional.empty();
    }

    // bare file names are also looked up, case-insensitively, under the platform font directories
    Optional<File> locate() {
        File file = new File(path);
        if (file.isFile()) {
            return Optional.of(file);
        }
        if (file.isAbsolute() || file.getParent() != null) {
            return Optional.empty();
        }
        for (File directory : fontDirectories) {
            if (!directory.isDirectory()) {
                continue;
            }
            try {
                Collection<File> matches = FileUtils.listFiles(directory,
                        new NameFileFilter(path, IOCase.INSENSITIVE), TrueFileFilter.INSTANCE);
                if (!matches.isEmpty()) {
                    return Optional.of(matches.iterator().next());
                }
            } catch (UncheckedIOException e) {
                log.debug("Skipping font directory {}: {}", directory, e.getMessage());
            }
        }
        return Optional.empty();
    }

    static List<File> systemFontDirectories() {
        List<File> directories = new ArrayList<>();
        String windowsDir = System.getenv("WINDIR");
        if (StringUtils.isNotBlank(windowsDir)) {
            directories.add(new File(windowsDir, "Fonts"));
        }
        String dataDirs = StringUtils.defaultIfBlank(System.getenv("XDG_DATA_DIRS"), "/usr/share:/usr/local/share");
        for (String dataDir : StringUtils.split(dataDirs, File.pathSeparatorChar)) {
            directories.add(new File(dataDir, "fonts"));
        }
        String home = System.getProperty("user.home");
        String dataHome = StringUtils.defaultIfBlank(System.getenv("XDG_DATA_HOME"), home + "/.local/share");
        directories.add(new File(dataHome, "fonts"));
        directories.add(new File(home, ".fonts"));
        directories.add(new File("/Library/Fonts"));
        directories.add(new File("/System/Library/Fonts"));
        directories.add(new File(home, "Library/Fonts"));
        return directories;
    }
}
