package com.reqgraph.core.query;

import com.reqgraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BDD catalog backed by Gherkin {@code .feature} files.
 *
 * <p>A file whose name contains {@code uow_NNN} or {@code uow-NNN} counts as an artifact for
 * unit of work {@code UoW-NNN}. The directory is scanned once, on construction.
 */
public class FeatureFileCatalog implements BddArtifactCatalog {

    private static final Logger log = LoggerFactory.getLogger(FeatureFileCatalog.class);
    private static final Pattern UOW_FILE = Pattern.compile("uow[_-](\\d+)", Pattern.CASE_INSENSITIVE);

    private final Set<String> covered;

    public FeatureFileCatalog(Path featuresDirectory) {
        this.covered = Collections.unmodifiableSet(scan(featuresDirectory));
    }

    @Override
    public boolean hasArtifact(String unitOfWorkId) {
        return covered.contains(normalize(unitOfWorkId));
    }

    /**
     * Returns the normalized IDs of covered units of work.
     *
     * @return IDs in the form {@code uow-NNN}
     */
    public Set<String> coveredUnits() {
        return covered;
    }

    private static Set<String> scan(Path directory) {
        Set<String> ids = new HashSet<>();
        try {
            for (Path file : FileUtils.findFiles(directory, "**.feature")) {
                Matcher matcher = UOW_FILE.matcher(FileUtils.getBaseName(file));
                if (matcher.find()) {
                    ids.add("uow-" + matcher.group(1));
                }
            }
        } catch (IOException e) {
            log.warn("Cannot scan feature files in {}: {}", directory, e.getMessage());
        }
        log.debug("Found BDD artifacts for {} units of work in {}", ids.size(), directory);
        return ids;
    }

    private static String normalize(String id) {
        return id.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
