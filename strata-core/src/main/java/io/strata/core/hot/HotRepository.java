package io.strata.core.hot;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface HotRepository {
    Optional<HotSnapshot> load(String ownerId) throws IOException;

    void save(HotSnapshot snapshot) throws IOException;

    List<String> owners() throws IOException;
}
