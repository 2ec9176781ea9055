package tech.noetzold.trust_engine_api.repository;

import tech.noetzold.trust_engine_api.model.Control;
import tech.noetzold.trust_engine_api.model.ControlRef;

import java.util.List;
import java.util.Optional;

public interface ControlCatalogRepository {
    long replaceAll(List<Control> controls);

    List<Control> findAll();

    Optional<Control> findByRef(ControlRef ref);

    long currentVersion();
}
