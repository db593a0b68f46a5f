package com.reqgraph.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.reqgraph.core.util.FileUtils;
import com.reqgraph.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads the authoritative YAML document store.
 *
 * <p><b>Layout:</b>
 * <pre>
 * framework-requirements.yaml      functional_requirements, non_functional_requirements,
 *                                  units_of_work sections, each keyed by ID
 * contracts/*.yaml                 one contract per file, ID from contract_id or file name
 * extensions/&lt;category&gt;/*.yaml    one extension per file, ID is &lt;category&gt;_&lt;file name&gt;
 * promoted-knowledge.yaml          patterns, decisions, lessons sections keyed by ID
 * </pre>
 *
 * <p>Files are visited in sorted order. A file that cannot be parsed is logged and
 * recorded as a warning; the remaining files still load.
 */
public class YamlDocumentLoader implements DocumentLoader {

    /** Main requirements document. */
    public static final String REQUIREMENTS_FILE = "framework-requirements.yaml";

    /** Knowledge promoted from the derived side. */
    public static final String PROMOTED_FILE = "promoted-knowledge.yaml";

    private static final Logger log = LoggerFactory.getLogger(YamlDocumentLoader.class);

    private static final Map<String, ArtifactKind> REQUIREMENT_SECTIONS = orderedSections(
        "functional_requirements", ArtifactKind.REQUIREMENT,
        "non_functional_requirements", ArtifactKind.QUALITY_ATTRIBUTE,
        "units_of_work", ArtifactKind.UNIT_OF_WORK);

    private static final Map<String, ArtifactKind> PROMOTED_SECTIONS = orderedSections(
        "patterns", ArtifactKind.PATTERN,
        "decisions", ArtifactKind.DECISION,
        "lessons", ArtifactKind.LESSON);

    private final Path root;

    public YamlDocumentLoader(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    @Override
    public DocumentSet load() {
        List<DocumentRecord> records = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        loadSections(root.resolve(REQUIREMENTS_FILE), REQUIREMENT_SECTIONS, records, warnings);
        loadContracts(records, warnings);
        loadExtensions(records, warnings);
        loadSections(root.resolve(PROMOTED_FILE), PROMOTED_SECTIONS, records, warnings);

        log.debug("Loaded {} document records from {} ({} warnings)", records.size(), root, warnings.size());
        return new DocumentSet(records, warnings);
    }

    private void loadSections(Path file, Map<String, ArtifactKind> sections,
                              List<DocumentRecord> records, List<String> warnings) {
        if (!Files.isRegularFile(file)) {
            log.debug("Document not present: {}", file);
            return;
        }
        JsonNode document = parse(file, warnings);
        if (document == null) {
            return;
        }
        String source = relative(file);
        sections.forEach((section, kind) -> {
            JsonNode entries = document.get(section);
            if (entries == null || entries.isNull()) {
                return;
            }
            if (entries.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = entries.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    records.add(new DocumentRecord(entry.getKey(), kind, entry.getValue(), source));
                }
            } else if (entries.isArray()) {
                for (JsonNode entry : entries) {
                    records.add(new DocumentRecord(entry.path("id").asText(""), kind, entry, source));
                }
            } else {
                warn(warnings, "Section '" + section + "' in " + source + " is not a mapping");
            }
        });
    }

    private void loadContracts(List<DocumentRecord> records, List<String> warnings) {
        for (Path file : yamlFiles(root.resolve("contracts"), warnings)) {
            JsonNode content = parse(file, warnings);
            if (content == null) {
                continue;
            }
            String id = content.path("contract_id").asText("");
            if (id.isBlank()) {
                id = FileUtils.getBaseName(file);
            }
            records.add(new DocumentRecord(id, ArtifactKind.CONTRACT, content, relative(file)));
        }
    }

    private void loadExtensions(List<DocumentRecord> records, List<String> warnings) {
        Path extensions = root.resolve("extensions");
        for (Path file : yamlFiles(extensions, warnings)) {
            Path relativeToExtensions = extensions.relativize(file);
            if (relativeToExtensions.getNameCount() != 2) {
                log.debug("Skipping extension file outside a category directory: {}", file);
                continue;
            }
            JsonNode content = parse(file, warnings);
            if (content == null) {
                continue;
            }
            String category = relativeToExtensions.getName(0).toString();
            String id = category + "_" + FileUtils.getBaseName(file);
            records.add(new DocumentRecord(id, ArtifactKind.EXTENSION, content, relative(file)));
        }
    }

    private List<Path> yamlFiles(Path directory, List<String> warnings) {
        try {
            return FileUtils.findFiles(directory, "**.{yaml,yml}");
        } catch (IOException e) {
            warn(warnings, "Cannot list " + relative(directory) + ": " + e.getMessage());
            return List.of();
        }
    }

    private JsonNode parse(Path file, List<String> warnings) {
        try {
            JsonNode node = JsonMappers.yaml().readTree(file.toFile());
            if (node == null || node.isMissingNode() || node.isNull()) {
                warn(warnings, "Document is empty: " + relative(file));
                return null;
            }
            return node;
        } catch (IOException e) {
            warn(warnings, "Cannot parse " + relative(file) + ": " + e.getMessage());
            return null;
        }
    }

    private void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }

    private String relative(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static Map<String, ArtifactKind> orderedSections(String firstKey, ArtifactKind first,
                                                             String secondKey, ArtifactKind second,
                                                             String thirdKey, ArtifactKind third) {
        Map<String, ArtifactKind> sections = new LinkedHashMap<>();
        sections.put(firstKey, first);
        sections.put(secondKey, second);
        sections.put(thirdKey, third);
        return Collections.unmodifiableMap(sections);
    }
}
