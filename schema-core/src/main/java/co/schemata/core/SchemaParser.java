package co.schemata.core;

import co.schemata.core.errors.SchemaParseException;
import co.schemata.core.model.DefaultValue;
import co.schemata.core.model.ExtractionField;
import co.schemata.core.model.FieldDefinition;
import co.schemata.core.model.SchemaDefinition;
import co.schemata.core.model.SchemaDocument;
import co.schemata.core.model.Target;
import co.schemata.core.model.TargetOverride;
import co.schemata.core.types.LogicalType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one YAML schema description into a {@link SchemaDefinition}.
 *
 * <p>The parser records {@code extends} but never resolves it; see
 * {@link InheritanceResolver}.
 */
public final class SchemaParser {
  private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private SchemaParser() {}

  /**
   * @param source     YAML text
   * @param sourceName file name used in diagnostics and generated headers, e.g. {@code venue.yaml}
   */
  public static SchemaDefinition parse(String source, String sourceName) {
    if (source == null || source.isBlank()) {
      throw new SchemaParseException(sourceName, null, "schema description is empty");
    }

    SchemaDocument doc;
    try {
      doc = YAML.readValue(source, SchemaDocument.class);
    } catch (JsonProcessingException e) {
      throw new SchemaParseException(sourceName, "not a valid schema description: " + e.getOriginalMessage(), e);
    }
    if (doc == null) throw new SchemaParseException(sourceName, null, "schema description is empty");

    SchemaDocumentValidator.validate(doc, sourceName);

    List<FieldDefinition> fields = new ArrayList<>(doc.fields.size());
    for (SchemaDocument.Field f : doc.fields) {
      fields.add(toField(f));
    }

    List<ExtractionField> extractionFields = new ArrayList<>();
    if (doc.extractionFields != null) {
      for (SchemaDocument.ExtractionEntry e : doc.extractionFields) {
        extractionFields.add(toExtractionField(e));
      }
    }

    SchemaDefinition schema = new SchemaDefinition(
        doc.schema.name, doc.schema.description.trim(), doc.schema.extendsName, fields, extractionFields);
    log.debug("Parsed schema {} from {}: {} fields, {} extraction fields, extends={}",
        schema.name(), sourceName, fields.size(), extractionFields.size(), schema.extendsName());
    return schema;
  }

  private static FieldDefinition toField(SchemaDocument.Field f) {
    FieldDefinition.Builder b = FieldDefinition.builder(f.name, logicalType(f.type))
        .description(f.description)
        .required(f.required)
        .index(f.index)
        .unique(f.unique)
        .primaryKey(f.primaryKey)
        .exclude(f.exclude)
        .foreignKey(f.foreignKey)
        .defaultValue(DefaultValue.parse(f.defaultValue))
        .overrides(toOverrides(f.targets));
    if (f.nullable != null) b.nullable(f.nullable);
    // keys are never null
    if (f.primaryKey && f.nullable == null) b.nullable(false);
    if (f.search != null) b.search(f.search.category, f.search.keywords);
    return b.build();
  }

  private static ExtractionField toExtractionField(SchemaDocument.ExtractionEntry e) {
    boolean nullable = e.nullable != null ? e.nullable : !e.required;
    Map<Target, TargetOverride> overrides = toOverrides(e.targets);
    return new ExtractionField(e.name, logicalType(e.type), e.description, nullable, e.required,
        overrides.get(Target.EXTRACTION));
  }

  private static Map<Target, TargetOverride> toOverrides(Map<String, SchemaDocument.TargetBlock> targets) {
    Map<Target, TargetOverride> out = new EnumMap<>(Target.class);
    if (targets == null) return out;
    targets.forEach((key, block) -> {
      Target t = Target.fromKey(key).orElseThrow();
      if (block == null) return;
      out.put(t, new TargetOverride(
          block.name,
          block.type == null ? null : block.type.trim(),
          block.validators,
          Boolean.TRUE.equals(block.skip),
          DefaultValue.parse(block.defaultValue),
          block.required,
          block.attributes));
    });
    return out;
  }

  private static LogicalType logicalType(String type) {
    // validated above
    return LogicalType.parse(type).orElseThrow();
  }
}
