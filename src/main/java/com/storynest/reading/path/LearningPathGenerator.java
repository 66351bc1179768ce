package com.storynest.reading.path;

import com.storynest.reading.config.LearningPathProperties;
import com.storynest.reading.config.LearningPathProperties.Stage;
import com.storynest.reading.domain.DomainModels.ActivityStatus;
import com.storynest.reading.domain.DomainModels.ChildProfile;
import com.storynest.reading.domain.DomainModels.LearningPath;
import com.storynest.reading.domain.DomainModels.PathActivity;
import com.storynest.reading.path.LearningPathModels.LearningPathView;
import com.storynest.reading.repository.LearningPathJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class LearningPathGenerator {
    private static final Logger log = LoggerFactory.getLogger(LearningPathGenerator.class);

    private final LearningPathJdbcRepository repository;
    private final LearningPathProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public LearningPathGenerator(LearningPathJdbcRepository repository,
                                 LearningPathProperties properties,
                                 TransactionTemplate transactionTemplate,
                                 Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public LearningPathView generate(ChildProfile profile) {
        return generate(profile, properties.stages());
    }

    public LearningPathView generate(ChildProfile profile, List<Stage> template) {
        if (profile.id() == null) {
            throw new IllegalArgumentException("Profile must be persisted before a learning path is generated");
        }
        if (template == null || template.isEmpty()) {
            throw new IllegalArgumentException("Stage template must contain at least one stage");
        }

        LearningPathView view = transactionTemplate.execute(tx -> {
            Instant now = clock.instant();
            LearningPath path = repository.insertPath(new LearningPath(null, profile.id(),
                    String.format(properties.titlePattern(), profile.name()),
                    String.format(properties.descriptionPattern(), profile.age(), profile.readingLevel()),
                    1, template.size(), 0, now, now));

            List<PathActivity> activities = new ArrayList<>(template.size());
            for (int i = 0; i < template.size(); i++) {
                Stage stage = template.get(i);
                activities.add(repository.insertActivity(new PathActivity(null, path.id(),
                        stage.title(), stage.description(), stage.type(), null,
                        i + 1, ActivityStatus.PENDING, false, now)));
            }
            return new LearningPathView(path, List.copyOf(activities));
        });

        log.info("Generated learning path {} with {} stages for profile {}",
                view.path().id(), view.path().totalStages(), profile.id());
        return view;
    }
}
