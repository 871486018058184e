package dev.roshin.proofscanner.analysis.core;

import com.google.common.base.Strings;
import com.google.common.io.Files;

/**
 * Picks a display name for a logical source file among the spellings its proof
 * items carry (spec, body and separate units such as "pkg.ads", "pkg.adb",
 * "pkg-child.adb").
 * <p>
 * Applied as a left fold over the candidates: shorter names win, and a
 * candidate that is an Ada spec wins over an equally long or longer current name.
 * Only the incoming candidate is examined, so a spec name that was already
 * adopted can still be displaced later by a shorter body name. Results
 * therefore depend on the order in which candidates are seen.
 */
public final class SourceNameResolver {

    private static final String SPEC_EXTENSION = "ads";

    private SourceNameResolver() {
    }

    /**
     * @param current   Name chosen so far, null or empty if none yet
     * @param candidate Newly seen spelling
     * @return the name to keep
     */
    public static String resolve(String current, String candidate) {
        if (Strings.isNullOrEmpty(current)) {
            return candidate;
        }
        if (candidate.length() < current.length()) {
            return candidate;
        }
        if (isSpecification(candidate)) {
            return candidate;
        }
        return current;
    }

    static boolean isSpecification(String fileName) {
        return SPEC_EXTENSION.equalsIgnoreCase(Files.getFileExtension(fileName));
    }
}
