package io.strata.core.graph;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface GraphRepository {
    Optional<WarmSnapshot> load(String ownerId) throws IOException;

    void save(WarmSnapshot snapshot) throws IOException;

    List<String> owners() throws IOException;
}
