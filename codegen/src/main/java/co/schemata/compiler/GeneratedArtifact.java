package co.schemata.compiler;

import co.schemata.core.model.Target;

/**
 * One generated file, returned to the caller instead of being written to disk.
 *
 * @param sourceName schema source it was generated from
 * @param path       output path relative to the target's output directory, e.g.
 *                   {@code co/schemata/generated/Venue.java} or {@code venue.prisma}
 */
public record GeneratedArtifact(String sourceName, Target target, String path, String content) {}
