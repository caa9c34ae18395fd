package com.foursite.growth.repository;

import com.foursite.growth.entity.FeaturingEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FeaturingEventRepository extends JpaRepository<FeaturingEvent, UUID> {

    List<FeaturingEvent> findBySiteIdOrderByShareMultipleAsc(String siteId);
}
