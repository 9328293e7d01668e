package info.isaksson.erland.fmuhandler.reduce;

import info.isaksson.erland.fmuhandler.core.FmuArchive;
import info.isaksson.erland.fmuhandler.model.Causality;
import info.isaksson.erland.fmuhandler.model.ScalarVariable;
import info.isaksson.erland.fmuhandler.model.ScalarVariableQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** Deletes the parameters selected by a {@link ReductionConfig}. Only causality {@code parameter} is considered. */
public final class ParameterReducer {

    private static final Logger log = LoggerFactory.getLogger(ParameterReducer.class);

    private static final ScalarVariableQuery PARAMETERS = ScalarVariableQuery.any().withCausality(Causality.PARAMETER);

    private final ReductionConfig config;

    public ParameterReducer(ReductionConfig config) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        this.config = config;
    }

    /** @return names of the deleted variables, in document order */
    public List<String> reduce(FmuArchive archive) {
        if (archive == null) throw new IllegalArgumentException("archive must not be null");
        List<String> deleted = new ArrayList<>();
        for (ScalarVariable v : archive.query(PARAMETERS)) {
            if (config.shouldDelete(v.name)) {
                archive.deleteVariable(v.name);
                deleted.add(v.name);
                log.debug("{}: deleted parameter {}", archive.sourcePath().getFileName(), v.name);
            }
        }
        return deleted;
    }
}
