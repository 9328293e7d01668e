package info.isaksson.erland.fmuhandler.reduce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Which parameters to delete from a model description.
 *
 * <p>A parameter is deleted when its name matches at least one delete pattern and no keep
 * pattern. Keep patterns always win.</p>
 */
public final class ReductionConfig {

    public static final String DEFAULT_FILE_NAME = "parameter_reduction_config.json";

    public final List<NamePattern> keep;
    public final List<NamePattern> delete;

    public ReductionConfig(List<NamePattern> keep, List<NamePattern> delete) {
        this.keep = keep == null ? Collections.emptyList() : List.copyOf(keep);
        this.delete = delete == null ? Collections.emptyList() : List.copyOf(delete);
    }

    public static ReductionConfig ofGlobs(List<String> keep, List<String> delete) {
        return new ReductionConfig(compile(keep), compile(delete));
    }

    public boolean shouldDelete(String name) {
        boolean matched = false;
        for (NamePattern p : delete) {
            if (p.matches(name)) {
                matched = true;
                break;
            }
        }
        if (!matched) return false;
        for (NamePattern p : keep) {
            if (p.matches(name)) return false;
        }
        return true;
    }

    public boolean isEmpty() {
        return delete.isEmpty();
    }

    private static List<NamePattern> compile(List<String> globs) {
        List<NamePattern> out = new ArrayList<>();
        if (globs == null) return out;
        for (String g : globs) {
            out.add(NamePattern.compile(g));
        }
        return out;
    }

    @Override
    public String toString() {
        return "ReductionConfig{keep=" + keep + ", delete=" + delete + "}";
    }
}
