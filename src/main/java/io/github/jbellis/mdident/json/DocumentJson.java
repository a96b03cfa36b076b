package io.github.jbellis.mdident.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.jbellis.mdident.config.DriftPolicy;
import io.github.jbellis.mdident.config.IdentitySettings;
import io.github.jbellis.mdident.document.Document;
import io.github.jbellis.mdident.identity.IdentityCache;
import io.github.jbellis.mdident.identity.NodeId;
import io.github.jbellis.mdident.identity.StructureTooDeepException;
import io.github.jbellis.mdident.node.BlockQuote;
import io.github.jbellis.mdident.node.CodeBlock;
import io.github.jbellis.mdident.node.Heading;
import io.github.jbellis.mdident.node.HtmlBlock;
import io.github.jbellis.mdident.node.ListBlock;
import io.github.jbellis.mdident.node.ListItem;
import io.github.jbellis.mdident.node.Node;
import io.github.jbellis.mdident.node.NodeKind;
import io.github.jbellis.mdident.node.NodeVisitor;
import io.github.jbellis.mdident.node.Paragraph;
import io.github.jbellis.mdident.node.Table;
import io.github.jbellis.mdident.node.ThematicBreak;
import io.github.jbellis.mdident.source.SourceMap;
import io.github.jbellis.mdident.source.SourceSpan;
import io.github.jbellis.mdident.source.ViewSourceMapping;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes documents in the JSON interchange format:
 * <pre>
 * { "version": "1.0",
 *   "nodes": [ { "type": "heading", "id": "...", "level": 1, "text": "...", "metadata": {} } ],
 *   "view_mappings": [ { "id": "...", "start_offset": 0, "end_offset": 7,
 *                        "start_line": 1, "start_col": 0, "end_line": 1, "end_col": 7 } ] }
 * </pre>
 *
 * Ids are written for inspection and cross-checking only. Decoding always recomputes them; a
 * persisted id that disagrees with its content is reported as an {@link IdentityDrift} and handled
 * according to the configured {@link DriftPolicy}. The identity cache is never written, and every
 * decoded document starts with a fresh one.
 */
public class DocumentJson {
    private static final Logger logger = LogManager.getLogger(DocumentJson.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final IdentitySettings settings;

    public DocumentJson() {
        this(new ObjectMapper(), IdentitySettings.defaults());
    }

    public DocumentJson(ObjectMapper objectMapper, IdentitySettings settings) {
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public String write(Document document) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(document));
    }

    public ObjectNode toTree(Document document) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("version", document.version());
        ArrayNode nodes = root.putArray("nodes");
        var writer = new NodeWriter();
        for (Node node : document.nodes()) {
            nodes.add(node.accept(writer));
        }
        ArrayNode mappings = root.putArray("view_mappings");
        for (ViewSourceMapping mapping : document.viewMappings()) {
            SourceSpan span = mapping.span();
            ObjectNode json = mappings.addObject();
            json.put("id", mapping.nodeId().toString());
            if (span.hasOffsets()) {
                json.put("start_offset", span.startOffset());
                json.put("end_offset", span.endOffset());
            }
            json.put("start_line", span.startLine());
            json.put("start_col", span.startColumn());
            json.put("end_line", span.endLine());
            json.put("end_col", span.endColumn());
        }
        return root;
    }

    /**
     * Decodes a document, recomputing every id.
     *
     * @throws IdentityDriftException if a persisted id disagrees with its content and the drift
     *         policy is {@link DriftPolicy#FAIL}
     * @throws DocumentFormatException if the JSON is not a well-formed document
     */
    public DecodedDocument read(String json) throws DocumentFormatException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    public DecodedDocument read(JsonNode root) throws DocumentFormatException {
        if (root == null || !root.isObject()) {
            throw new DocumentFormatException("JSON must be an object");
        }
        if (!root.has("nodes")) {
            throw new DocumentFormatException("Document JSON must contain 'nodes' field");
        }
        JsonNode nodesJson = root.get("nodes");
        if (!nodesJson.isArray()) {
            throw new DocumentFormatException("'nodes' field must be an array");
        }
        String version = root.path("version").asText(Document.FORMAT_VERSION);
        if (!Document.FORMAT_VERSION.equals(version)) {
            logger.warn("Reading document format version {} (expected {})", version, Document.FORMAT_VERSION);
        }

        var decoder = new Decoder(Document.newCache(settings));
        var nodes = new ArrayList<Node>(nodesJson.size());
        for (int i = 0; i < nodesJson.size(); i++) {
            nodes.add(decoder.decode(nodesJson.get(i), "nodes[" + i + "]", 1));
        }
        SourceMap sourceMap = readMappings(root.get("view_mappings")).rekey(decoder.replacements);
        var document = Document.fromIdentified(nodes, sourceMap, version, settings, decoder.cache);
        if (!decoder.drifts.isEmpty()) {
            logger.warn("Decoded document with {} drifted ids", decoder.drifts.size());
        }
        logger.debug("Decoded {}", document);
        return new DecodedDocument(document, decoder.drifts);
    }

    private SourceMap readMappings(JsonNode json) throws DocumentFormatException {
        if (json == null || json.isNull()) {
            return SourceMap.empty();
        }
        if (!json.isArray()) {
            throw new DocumentFormatException("'view_mappings' field must be an array");
        }
        var builder = SourceMap.builder();
        for (int i = 0; i < json.size(); i++) {
            JsonNode mapping = json.get(i);
            String location = "view_mappings[" + i + "]";
            if (!mapping.isObject()) {
                throw new DocumentFormatException("Mapping at " + location + " must be an object");
            }
            NodeId id = readId(mapping, location)
                    .orElseThrow(() -> new DocumentFormatException("Mapping at " + location + " must have 'id' field"));
            SourceSpan span;
            try {
                span = new SourceSpan(
                        mapping.path("start_offset").asInt(SourceSpan.UNKNOWN_OFFSET),
                        mapping.path("end_offset").asInt(SourceSpan.UNKNOWN_OFFSET),
                        requireInt(mapping, "start_line", location),
                        requireInt(mapping, "start_col", location),
                        requireInt(mapping, "end_line", location),
                        requireInt(mapping, "end_col", location));
            } catch (IllegalArgumentException e) {
                throw new DocumentFormatException("Invalid span at " + location + ": " + e.getMessage(), e);
            }
            builder.record(id, span);
        }
        return builder.build();
    }

    private static Optional<NodeId> readId(JsonNode json, String location) throws DocumentFormatException {
        JsonNode id = json.get("id");
        if (id == null || id.isNull()) {
            return Optional.empty();
        }
        if (!id.isTextual() || !NodeId.isWellFormed(id.asText())) {
            throw new DocumentFormatException("Invalid id " + id + " at " + location);
        }
        return Optional.of(NodeId.parse(id.asText()));
    }

    private static int requireInt(JsonNode json, String field, String location) throws DocumentFormatException {
        JsonNode value = json.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new DocumentFormatException(location + " must have integer '" + field + "' field");
        }
        return value.asInt();
    }

    private static String requireText(JsonNode json, String field, String location) throws DocumentFormatException {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual()) {
            throw new DocumentFormatException("Node at " + location + " must have string '" + field + "' field");
        }
        return value.asText();
    }

    private static JsonNode requireArray(JsonNode json, String field, String location) throws DocumentFormatException {
        JsonNode value = json.get(field);
        if (value == null || !value.isArray()) {
            throw new DocumentFormatException("Node at " + location + " must have array '" + field + "' field");
        }
        return value;
    }

    private final class Decoder {
        private final IdentityCache cache;
        private final List<IdentityDrift> drifts = new ArrayList<>();
        private final Map<NodeId, NodeId> replacements = new HashMap<>();

        Decoder(IdentityCache cache) {
            this.cache = cache;
        }

        Node decode(JsonNode json, String location, int depth) throws DocumentFormatException {
            if (depth > settings.maxDepth()) {
                throw new DocumentFormatException("Structure too deep at " + location,
                                                  new StructureTooDeepException(depth, settings.maxDepth(), List.of(location)));
            }
            if (!json.isObject()) {
                throw new DocumentFormatException("Node at " + location + " must be an object");
            }
            JsonNode typeJson = json.get("type");
            if (typeJson == null || !typeJson.isTextual()) {
                throw new DocumentFormatException("Node at " + location + " must have 'type' field");
            }
            String type = typeJson.asText();
            NodeKind kind = NodeKind.fromJsonType(type)
                    .orElseThrow(() -> new DocumentFormatException("Unknown node type '" + type + "' at " + location));
            Map<String, Object> metadata = readMetadata(json, location);

            Node draft = switch (kind) {
                case HEADING -> {
                    int level = requireInt(json, "level", location);
                    if (level < Heading.MIN_LEVEL || level > Heading.MAX_LEVEL) {
                        throw new DocumentFormatException("Heading level " + level + " out of range at " + location);
                    }
                    yield new Heading(level, requireText(json, "text", location), metadata, null);
                }
                case PARAGRAPH -> new Paragraph(requireText(json, "text", location), metadata, null);
                case CODE_BLOCK -> {
                    JsonNode language = json.get("language");
                    String lang = language == null || language.isNull() ? null : language.asText();
                    yield new CodeBlock(lang, requireText(json, "code", location), metadata, null);
                }
                case LIST -> {
                    var items = new ArrayList<ListItem>();
                    JsonNode itemsJson = requireArray(json, "items", location);
                    for (int i = 0; i < itemsJson.size(); i++) {
                        String itemLocation = location + ".items[" + i + "]";
                        Node item = decode(itemsJson.get(i), itemLocation, depth + 1);
                        if (!(item instanceof ListItem listItem)) {
                            throw new DocumentFormatException("Expected list_item at " + itemLocation + ", got " + item.kind().jsonType());
                        }
                        items.add(listItem);
                    }
                    int start = json.path("start").asInt(1);
                    if (start < 0) {
                        throw new DocumentFormatException("List start " + start + " is negative at " + location);
                    }
                    yield new ListBlock(json.path("ordered").asBoolean(false), start, items, metadata, null);
                }
                case LIST_ITEM -> new ListItem(decodeChildren(json, location, depth), metadata, null);
                case BLOCK_QUOTE -> new BlockQuote(decodeChildren(json, location, depth), metadata, null);
                case THEMATIC_BREAK -> new ThematicBreak(metadata, null);
                case HTML_BLOCK -> new HtmlBlock(requireText(json, "html", location), metadata, null);
                case TABLE -> new Table(readRows(json, location), metadata, null);
            };

            Node identified;
            try {
                identified = cache.identify(draft);
            } catch (StructureTooDeepException e) {
                throw new DocumentFormatException("Structure too deep at " + location, e);
            }
            var persisted = readId(json, location);
            if (persisted.isPresent() && !persisted.get().equals(identified.id())) {
                var drift = new IdentityDrift(location, kind, persisted.get(), identified.requireId());
                if (settings.driftPolicy() == DriftPolicy.FAIL) {
                    throw new IdentityDriftException(drift);
                }
                logger.warn("Identity drift for {}", drift);
                drifts.add(drift);
                replacements.put(drift.persisted(), drift.recomputed());
            }
            return identified;
        }

        private List<Node> decodeChildren(JsonNode json, String location, int depth) throws DocumentFormatException {
            JsonNode childrenJson = requireArray(json, "children", location);
            var children = new ArrayList<Node>(childrenJson.size());
            for (int i = 0; i < childrenJson.size(); i++) {
                children.add(decode(childrenJson.get(i), location + ".children[" + i + "]", depth + 1));
            }
            return children;
        }

        private List<List<String>> readRows(JsonNode json, String location) throws DocumentFormatException {
            JsonNode rowsJson = requireArray(json, "rows", location);
            var rows = new ArrayList<List<String>>(rowsJson.size());
            for (JsonNode rowJson : rowsJson) {
                if (!rowJson.isArray()) {
                    throw new DocumentFormatException("Table rows at " + location + " must be arrays of strings");
                }
                var row = new ArrayList<String>(rowJson.size());
                for (JsonNode cell : rowJson) {
                    row.add(cell.asText());
                }
                rows.add(row);
            }
            return rows;
        }

        private Map<String, Object> readMetadata(JsonNode json, String location) throws DocumentFormatException {
            JsonNode metadata = json.get("metadata");
            if (metadata == null || metadata.isNull()) {
                return Map.of();
            }
            if (!metadata.isObject()) {
                throw new DocumentFormatException("Metadata at " + location + " must be an object");
            }
            return objectMapper.convertValue(metadata, METADATA_TYPE);
        }
    }

    private final class NodeWriter implements NodeVisitor<ObjectNode> {
        private ObjectNode start(Node node) {
            ObjectNode json = objectMapper.createObjectNode();
            json.put("type", node.kind().jsonType());
            json.put("id", node.requireId().toString());
            return json;
        }

        private ObjectNode finish(ObjectNode json, Node node) {
            json.set("metadata", objectMapper.valueToTree(node.metadata()));
            return json;
        }

        private ArrayNode writeChildren(List<? extends Node> children) {
            ArrayNode array = objectMapper.createArrayNode();
            for (Node child : children) {
                array.add(child.accept(this));
            }
            return array;
        }

        @Override
        public ObjectNode visitHeading(Heading heading) {
            ObjectNode json = start(heading);
            json.put("level", heading.level());
            json.put("text", heading.text());
            return finish(json, heading);
        }

        @Override
        public ObjectNode visitParagraph(Paragraph paragraph) {
            ObjectNode json = start(paragraph);
            json.put("text", paragraph.text());
            return finish(json, paragraph);
        }

        @Override
        public ObjectNode visitCodeBlock(CodeBlock codeBlock) {
            ObjectNode json = start(codeBlock);
            json.put("language", codeBlock.language());
            json.put("code", codeBlock.code());
            return finish(json, codeBlock);
        }

        @Override
        public ObjectNode visitList(ListBlock list) {
            ObjectNode json = start(list);
            json.put("ordered", list.ordered());
            json.put("start", list.start());
            json.set("items", writeChildren(list.items()));
            return finish(json, list);
        }

        @Override
        public ObjectNode visitListItem(ListItem item) {
            ObjectNode json = start(item);
            json.set("children", writeChildren(item.children()));
            return finish(json, item);
        }

        @Override
        public ObjectNode visitBlockQuote(BlockQuote blockQuote) {
            ObjectNode json = start(blockQuote);
            json.set("children", writeChildren(blockQuote.children()));
            return finish(json, blockQuote);
        }

        @Override
        public ObjectNode visitThematicBreak(ThematicBreak thematicBreak) {
            return finish(start(thematicBreak), thematicBreak);
        }

        @Override
        public ObjectNode visitHtmlBlock(HtmlBlock htmlBlock) {
            ObjectNode json = start(htmlBlock);
            json.put("html", htmlBlock.html());
            return finish(json, htmlBlock);
        }

        @Override
        public ObjectNode visitTable(Table table) {
            ObjectNode json = start(table);
            ArrayNode rows = json.putArray("rows");
            for (List<String> row : table.rows()) {
                ArrayNode rowJson = rows.addArray();
                row.forEach(rowJson::add);
            }
            return finish(json, table);
        }
    }
}
