package no.cantara.ksg;

import no.cantara.ksg.concept.DefaultPrototypes;
import no.cantara.ksg.model.ReservedKeys;
import no.cantara.ksg.pattern.PatternEvolution;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static no.cantara.ksg.TestSupport.PROV;
import static org.junit.jupiter.api.Assertions.*;

class KnowShowGoTest {

    @Test void inMemoryInstanceIsSeededOnce() {
        KnowShowGo ksg = KnowShowGo.inMemory(null);
        assertTrue(ksg.graph().findPrototype(DefaultPrototypes.FORM_PATTERN).isPresent());
        int concepts = ksg.store().search("", Integer.MAX_VALUE, Map.of()).size();

        Map<String, String> again = ksg.seedPrototypes(PROV);

        assertEquals(5, again.size());
        assertEquals(concepts, ksg.store().search("", Integer.MAX_VALUE, Map.of()).size());
    }

    @Test void secondSuccessfulSimilarPatternTriggersGeneralization() {
        KnowShowGo ksg = KnowShowGo.inMemory(null);
        List<Double> login = List.of(1.0, 0.0);
        String a = ksg.patterns().storePattern("example.com:login", Map.of("form_type", "login"), login, PROV);
        String b = ksg.patterns().storePattern("other.com:login", Map.of("form_type", "login"), login, PROV);

        assertTrue(ksg.recordSuccess(a, Map.of(), null, PROV).isEmpty(), "no successful peer yet");
        Optional<PatternEvolution.GeneralizationResult> result = ksg.recordSuccess(b, Map.of(), null, PROV);

        assertTrue(result.isPresent());
        assertEquals(List.of(b, a), result.get().exemplarUuids());
        assertEquals(PatternEvolution.GENERALIZED,
                ksg.store().findConcept(result.get().generalizedUuid()).orElseThrow().props().get(ReservedKeys.TYPE));
    }

    @Test void successOnUnknownPatternGeneralizesNothing() {
        assertTrue(KnowShowGo.inMemory(null).recordSuccess("missing", Map.of(), null, PROV).isEmpty());
    }
}
