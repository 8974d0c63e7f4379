package com.stockneuro.backend.forecasting.registry;

import com.stockneuro.backend.exception.ArtifactStorageException;
import com.stockneuro.backend.exception.NotFoundException;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.ModelAdapter;
import com.stockneuro.backend.forecasting.adapter.ModelHandle;
import com.stockneuro.backend.forecasting.data.ScaleParams;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import com.stockneuro.backend.model.ModelVersion;
import com.stockneuro.backend.model.TrainingRun;
import com.stockneuro.backend.repository.ModelVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sole owner of model versions. Registration and the promotion swap run under a
 * per-architecture lock inside one transaction, so concurrent candidates of the same
 * architecture are decided one at a time against the current serving version.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelRegistryService {

    private final ModelVersionRepository repository;
    private final ArtifactStore artifactStore;
    private final SafePromotionPolicy promotionPolicy;
    private final TransactionTemplate transactionTemplate;

    private final Map<Architecture, Object> locks = new ConcurrentHashMap<>();

    public RegistrationResult register(TrainingRun run, ModelAdapter adapter, ModelHandle handle,
                                       MetricSnapshot metrics, ScaleParams scaleParams) {
        byte[] artifact;
        try {
            artifact = adapter.serialize(handle);
        } catch (ArtifactStorageException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ArtifactStorageException("Failed to serialize " + run.getArchitecture() + " model for run "
                    + run.getRunId(), ex);
        }
        Architecture architecture = run.getArchitecture();
        Object lock = locks.computeIfAbsent(architecture, key -> new Object());
        synchronized (lock) {
            return transactionTemplate.execute(status -> registerLocked(run, handle, metrics, scaleParams, artifact));
        }
    }

    public List<ModelVersion> listVersions(Architecture architecture) {
        return repository.findByArchitectureOrderByVersionNumberAsc(architecture);
    }

    public Optional<ModelVersion> promotedVersion(Architecture architecture) {
        List<ModelVersion> promoted = repository.findByArchitectureAndPromotedTrue(architecture);
        if (promoted.size() > 1) {
            throw new IllegalStateException(promoted.size() + " versions of " + architecture + " are marked promoted");
        }
        return promoted.stream().findFirst();
    }

    public ModelVersion requirePromoted(Architecture architecture) {
        return promotedVersion(architecture)
                .orElseThrow(() -> new NotFoundException("No promoted " + architecture + " model; train one first"));
    }

    public byte[] loadArtifact(ModelVersion version) {
        return artifactStore.load(version.getArtifactRef());
    }

    private RegistrationResult registerLocked(TrainingRun run, ModelHandle handle, MetricSnapshot metrics,
                                              ScaleParams scaleParams, byte[] artifact) {
        Architecture architecture = run.getArchitecture();
        int versionNumber = repository.findTopByArchitectureOrderByVersionNumberDesc(architecture)
                .map(latest -> latest.getVersionNumber() + 1)
                .orElse(1);
        String artifactRef = artifactStore.store(architecture, versionNumber, run.getRunId(), artifact);
        Instant now = Instant.now();
        ModelVersion candidate = ModelVersion.builder()
                .architecture(architecture)
                .versionNumber(versionNumber)
                .runId(run.getRunId())
                .ticker(run.getTicker())
                .artifactRef(artifactRef)
                .stage(ModelVersion.Stage.CANDIDATE)
                .promoted(false)
                .sequenceLength(handle.inputLength())
                .effectiveLayers(handle.effectiveLayers())
                .scaleMin(scaleParams.min())
                .scaleMax(scaleParams.max())
                .createdAt(now)
                .build();
        candidate.applyMetrics(metrics);
        candidate = repository.save(candidate);

        ModelVersion incumbent = promotedVersion(architecture).orElse(null);
        PromotionDecision decision = promotionPolicy.decide(metrics, incumbent == null ? null : incumbent.metrics());
        if (decision.promote()) {
            if (incumbent != null) {
                incumbent.setPromoted(false);
                incumbent.setSupersededAt(now);
                incumbent.setSupersededByVersion(versionNumber);
                repository.save(incumbent);
            }
            candidate.transitionTo(ModelVersion.Stage.PROMOTED);
            candidate.setPromoted(true);
            candidate.setPromotedAt(now);
            log.info("Promoted {} v{} ({})", architecture, versionNumber, decision.reason());
        } else {
            candidate.transitionTo(ModelVersion.Stage.REJECTED);
            candidate.setRejectionReason(decision.reason());
            log.info("Rejected {} v{} ({})", architecture, versionNumber, decision.reason());
        }
        candidate = repository.save(candidate);
        return new RegistrationResult(candidate, decision.promote() ? incumbent : null, decision);
    }
}
