package co.schemata.core;

import co.schemata.core.errors.SchemaParseException;
import co.schemata.core.model.SchemaDocument;
import co.schemata.core.model.Target;
import co.schemata.core.types.LogicalType;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks on a raw {@link SchemaDocument}. Everything that would make the
 * immutable model inconsistent is rejected here with a {@link SchemaParseException}.
 */
public final class SchemaDocumentValidator {

  static final String SUPPORTED_TYPES =
      "string, integer, float, boolean, datetime, json, list[string], list[integer], list[float], list[boolean]";

  private static final String SUPPORTED_TARGETS =
      Arrays.stream(Target.values()).map(Target::key).collect(Collectors.joining(", "));

  private SchemaDocumentValidator() {}

  public static void validate(SchemaDocument doc, String sourceName) {
    if (doc.schema == null) fail(sourceName, null, "schema block is required");
    String s = doc.schema.name;
    if (isBlank(s)) fail(sourceName, null, "schema.name is required");
    if (isBlank(doc.schema.description)) fail(s, null, "schema.description is required");
    if (doc.schema.extendsName != null && doc.schema.extendsName.isBlank()) fail(s, null, "schema.extends cannot be blank");
    if (s.equals(doc.schema.extendsName)) fail(s, null, "schema cannot extend itself");

    if (doc.fields == null || doc.fields.isEmpty()) fail(s, null, "fields must contain at least one field");

    Set<String> fieldNames = new HashSet<>();
    for (int i = 0; i < doc.fields.size(); i++) {
      SchemaDocument.Field f = doc.fields.get(i);
      if (f == null || isBlank(f.name)) fail(s, null, "fields[" + i + "]: name is required");
      if (!fieldNames.add(f.name)) fail(s, f.name, "duplicate field name");
      checkType(s, f.name, f.type);
      if (f.required && Boolean.TRUE.equals(f.nullable)) {
        fail(s, f.name, "a required field cannot be nullable");
      }
      if (f.primaryKey && Boolean.TRUE.equals(f.nullable)) {
        fail(s, f.name, "a primary key cannot be nullable");
      }
      checkTargets(s, f.name, f.targets, false);
    }

    if (doc.extractionFields == null) return;
    Set<String> extractionNames = new HashSet<>();
    for (int i = 0; i < doc.extractionFields.size(); i++) {
      SchemaDocument.ExtractionEntry e = doc.extractionFields.get(i);
      if (e == null || isBlank(e.name)) fail(s, null, "extraction_fields[" + i + "]: name is required");
      if (!extractionNames.add(e.name)) fail(s, e.name, "duplicate extraction field name");
      checkType(s, e.name, e.type);
      if (e.required && Boolean.TRUE.equals(e.nullable)) {
        fail(s, e.name, "a required field cannot be nullable");
      }
      checkTargets(s, e.name, e.targets, true);
    }
  }

  private static void checkType(String s, String field, String type) {
    if (isBlank(type)) fail(s, field, "type is required");
    if (!LogicalType.isValid(type)) {
      fail(s, field, "unsupported type '" + type + "'. Supported types: " + SUPPORTED_TYPES);
    }
  }

  private static void checkTargets(String s, String field, Map<String, SchemaDocument.TargetBlock> targets,
                                   boolean extractionOnly) {
    if (targets == null) return;
    for (Map.Entry<String, SchemaDocument.TargetBlock> e : targets.entrySet()) {
      Optional<Target> target = Target.fromKey(e.getKey());
      if (target.isEmpty()) {
        fail(s, field, "unknown target '" + e.getKey() + "'. Supported targets: " + SUPPORTED_TARGETS);
      }
      Target t = target.get();
      if (extractionOnly && t != Target.EXTRACTION) {
        failTarget(s, field, t, "extraction_fields only accept an extraction override");
      }
      SchemaDocument.TargetBlock b = e.getValue();
      if (b == null) continue;

      if (b.name != null && b.name.isBlank()) failTarget(s, field, t, "name override cannot be blank");
      if (b.type != null && b.type.isBlank()) failTarget(s, field, t, "type override cannot be blank");

      if (t != Target.EXTRACTION) {
        if (b.validators != null && !b.validators.isEmpty()) {
          failTarget(s, field, t, "validators are only supported on the extraction target");
        }
        if (b.required != null) failTarget(s, field, t, "required is only supported on the extraction target");
      }
      if (t != Target.STORAGE && b.attributes != null) {
        failTarget(s, field, t, "attributes are only supported on the storage target");
      }
      if ((t == Target.INTERFACE || t == Target.EXTRACTION) && b.defaultValue != null) {
        failTarget(s, field, t, "default is only supported on the record and storage targets");
      }
      if (b.validators != null) {
        for (String v : b.validators) {
          if (isBlank(v)) failTarget(s, field, t, "validator names cannot be empty");
        }
      }
    }
  }

  private static boolean isBlank(String s) { return s == null || s.isBlank(); }

  private static void fail(String schema, String field, String msg) {
    throw new SchemaParseException(schema, field, msg);
  }

  private static void failTarget(String schema, String field, Target target, String msg) {
    throw new SchemaParseException(schema, field, target.key(), msg);
  }
}
