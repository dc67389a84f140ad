package com.mockgen.generator.remove;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * What the remove command deletes and how.
 */
@Value
@Builder
public class RemoveOptions {

    @NonNull
    Path root;

    boolean recursive;

    /** Ask before each deletion. */
    boolean interactive;

    /** Report what would be deleted without deleting. */
    boolean dryRun;

    /** Print nothing. */
    boolean silent;
}
