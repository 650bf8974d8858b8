package com.intent.vision.core.repo.documents;

import com.intent.vision.core.model.documents.AlertEventDoc;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertEventRepo extends MongoRepository<AlertEventDoc, String> {

    List<AlertEventDoc> findByOrgIdAndRuleIdOrderByTriggeredAtDesc(String orgId, String ruleId);
}
