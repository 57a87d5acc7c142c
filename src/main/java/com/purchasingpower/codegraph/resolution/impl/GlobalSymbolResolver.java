package com.purchasingpower.codegraph.resolution.impl;

import com.purchasingpower.codegraph.core.Entity;
import com.purchasingpower.codegraph.core.EntityRegistry;
import com.purchasingpower.codegraph.core.Relationship;
import com.purchasingpower.codegraph.core.TargetRef;
import com.purchasingpower.codegraph.resolution.ResolutionReport;
import com.purchasingpower.codegraph.resolution.SymbolIndex;
import com.purchasingpower.codegraph.resolution.SymbolResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves placeholders by bare name and kind hint across the whole registry.
 *
 * <p>One candidate resolves; none yields {@code Unresolved:<name>}; more than one yields
 * {@code Ambiguous:<name>}. Names are never disambiguated by import scope. Edges of one source
 * that end up identical (a shared file imported as a member by one project and through a
 * placeholder by another) are collapsed.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class GlobalSymbolResolver implements SymbolResolver {

    @Override
    public ResolutionReport resolve(EntityRegistry registry) {
        long startTime = System.currentTimeMillis();
        SymbolIndex index = new SymbolIndex(registry);
        ResolutionReport report = new ResolutionReport();

        for (Entity source : registry.getEntities()) {
            for (Relationship relationship : source.getRelationships()) {
                TargetRef target = relationship.getTarget();
                if (!target.isPlaceholder()) {
                    report.recordUntouched();
                    continue;
                }

                List<Entity> candidates = index.candidates(target.hint(), target.value());
                if (candidates.size() == 1) {
                    relationship.retarget(TargetRef.resolved(candidates.get(0).getId()));
                    report.recordResolved();
                } else if (candidates.isEmpty()) {
                    log.debug("Unresolved {} from {}: no {} named '{}'",
                            relationship.getKind(), source.getKey(), target.hint().getLabel(), target.value());
                    relationship.retarget(TargetRef.unresolved(target.value()));
                    report.recordUnresolved();
                } else {
                    log.warn("⚠️  Ambiguous {} from {} to '{}': {} candidates ({})",
                            relationship.getKind(), source.getKey(), target.value(), candidates.size(),
                            candidates.stream().map(Entity::getKey).toList());
                    relationship.retarget(TargetRef.ambiguous(target.value()));
                    report.recordAmbiguous();
                }
            }

            int removed = source.removeDuplicateRelationships();
            if (removed > 0) {
                log.debug("Dropped {} duplicate relationship(s) of {} after resolution", removed, source.getKey());
                report.recordDuplicatesRemoved(removed);
            }
        }

        log.info("Resolved {} placeholder(s): {} resolved, {} unresolved, {} ambiguous, {} duplicate(s) dropped ({}ms)",
                report.getPlaceholders(), report.getResolved(), report.getUnresolved(), report.getAmbiguous(),
                report.getDuplicatesRemoved(), System.currentTimeMillis() - startTime);
        return report;
    }
}
