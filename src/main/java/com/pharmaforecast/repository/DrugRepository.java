package com.pharmaforecast.repository;

import com.pharmaforecast.entity.Drug;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DrugRepository extends JpaRepository<Drug, Integer> {

    List<Drug> findAllByOrderByIdAsc();
}
