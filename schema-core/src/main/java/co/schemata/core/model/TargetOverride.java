package co.schemata.core.model;

import java.util.List;

/**
 * Per-target adjustments declared under a field's {@code targets.<target>} block.
 *
 * <p>{@code validators} and {@code required} are only accepted on the extraction target;
 * {@code attributes} only on the storage target. The parser enforces this.
 *
 * @param name       rename the field for this target
 * @param type       explicit target type expression, used verbatim
 * @param validators named validators (extraction only)
 * @param skip       omit the field from this target
 * @param defaultValue target-specific default, replacing the field default
 * @param required   extraction-required flag, {@code null} when not declared
 * @param attributes verbatim storage attributes replacing computed ones (storage only)
 */
public record TargetOverride(
    String name,
    String type,
    List<String> validators,
    boolean skip,
    DefaultValue defaultValue,
    Boolean required,
    List<String> attributes
) {
  public TargetOverride {
    validators = validators == null ? List.of() : List.copyOf(validators);
    attributes = attributes == null ? null : List.copyOf(attributes);
  }

  public static TargetOverride rename(String name) {
    return new TargetOverride(name, null, null, false, null, null, null);
  }

  public static TargetOverride type(String type) {
    return new TargetOverride(null, type, null, false, null, null, null);
  }

  public static TargetOverride skipped() {
    return new TargetOverride(null, null, null, true, null, null, null);
  }

  public boolean isRequired() { return Boolean.TRUE.equals(required); }
}
