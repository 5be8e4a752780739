package io.mnemo.core.audit;

import io.mnemo.core.model.AttemptRecord;
import java.io.IOException;
import java.util.List;

public interface AttemptStore {
    List<AttemptRecord> load() throws IOException;

    void save(List<AttemptRecord> records) throws IOException;
}
