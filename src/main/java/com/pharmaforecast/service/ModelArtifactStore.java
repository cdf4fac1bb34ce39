package com.pharmaforecast.service;

import com.pharmaforecast.model.ModelArtifact;

import java.util.List;

public interface ModelArtifactStore {

    /**
     * @return every artifact currently published, in a stable order
     * @throws com.pharmaforecast.exception.ModelLoadException when the store itself cannot be listed
     */
    List<ModelArtifact> list();

    String location();
}
