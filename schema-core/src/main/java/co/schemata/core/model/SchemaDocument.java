package co.schemata.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Raw YAML shape of a schema description, bound by Jackson before validation.
 *
 * <p>Unknown keys are rejected by the parser's mapper; nothing here is trusted until
 * {@link co.schemata.core.SchemaDocumentValidator} has run.
 */
public class SchemaDocument {
  public Header schema;
  public List<Field> fields;
  @JsonProperty("extraction_fields")
  public List<ExtractionEntry> extractionFields;

  public static class Header {
    public String name;
    public String description;
    @JsonProperty("extends")
    public String extendsName;
  }

  public static class Field {
    public String name;
    public String type;
    public String description;
    /** Omitted means "not nullable when required, nullable otherwise". */
    public Boolean nullable;
    public boolean required;
    public boolean index;
    public boolean unique;
    @JsonProperty("primary_key")
    public boolean primaryKey;
    @JsonAlias("internal")
    public boolean exclude;
    @JsonProperty("foreign_key")
    public String foreignKey;
    @JsonProperty("default")
    public Object defaultValue;
    public Search search;
    /** Keyed by target name: record, storage, interface, extraction. */
    public Map<String, TargetBlock> targets;
  }

  public static class Search {
    public String category;
    public List<String> keywords;
  }

  /**
   * One {@code targets.<target>} block. Which keys are legal depends on the target;
   * see {@link TargetOverride}.
   */
  public static class TargetBlock {
    public String name;
    public String type;
    /** A single name is accepted in place of a list. */
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    public List<String> validators;
    public Boolean skip;
    @JsonProperty("default")
    public Object defaultValue;
    public Boolean required;
    public List<String> attributes;
  }

  public static class ExtractionEntry {
    public String name;
    public String type;
    public String description;
    public Boolean nullable;
    public boolean required;
    public Map<String, TargetBlock> targets;
  }
}
