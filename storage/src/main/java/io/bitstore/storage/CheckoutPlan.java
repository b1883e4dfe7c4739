// file: storage/src/main/java/io/bitstore/storage/CheckoutPlan.java
package io.bitstore.storage;

import io.bitstore.core.SaveRecord;
import io.bitstore.core.ignore.IgnoreRules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a checkout will do to the working tree, computed before anything is
 * touched.
 *
 * @param target        save being checked out
 * @param ignoreSpec    content to write to the ignore-spec file first, or null
 *                      to keep whatever is on disk
 * @param rules         ignore rules in force for the rest of the checkout
 * @param toDelete      tracked files present now but absent from the target
 * @param toWrite       target files to rebuild and write
 * @param preserved     ignored files and their content before the checkout;
 *                      written back last
 */
public record CheckoutPlan(
        SaveRecord target,
        byte[] ignoreSpec,
        IgnoreRules rules,
        List<String> toDelete,
        List<String> toWrite,
        Map<String, byte[]> preserved
) {
    public CheckoutPlan {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(rules, "rules");
        toDelete = List.copyOf(toDelete);
        toWrite = List.copyOf(toWrite);
        preserved = Collections.unmodifiableMap(new LinkedHashMap<>(preserved));
    }

    public boolean restoresIgnoreSpec() {
        return ignoreSpec != null;
    }
}
