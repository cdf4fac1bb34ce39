package com.pharmaforecast.model;

import com.pharmaforecast.entity.Drug;

/** Catalog metadata, detached from the persistence context. */
public record DrugInfo(long id, String name, String unit, int reorderLevel, int reorderQuantity) {

    public static DrugInfo from(Drug drug) {
        return new DrugInfo(drug.getId(), drug.getName(), drug.getUnit(),
            drug.getReorderLevel(), drug.getReorderQuantity());
    }

    public static DrugInfo unknown(long id, int defaultReorderLevel) {
        return new DrugInfo(id, "Drug " + id, "units", defaultReorderLevel, 0);
    }
}
