package com.ctdl.scout.service.validate;

import com.ctdl.scout.config.ScoutProperties;
import com.ctdl.scout.service.LoggerService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Screens scraped links by scheme, probes the survivors one after another and keeps the ones
 * the configured {@link AcceptancePolicy} calls available.
 * <p>
 * One {@code code: <status>\turl: <link>} line per probed link is written to standard output.
 */
@Service
@RequiredArgsConstructor
public class LinkValidator {

    private final LinkProbe linkProbe;
    private final ScoutProperties properties;
    private final LoggerService logger;

    /**
     * @param candidates links in scrape order
     * @return accepted links, first-seen order, without duplicates
     */
    public List<String> validate(List<String> candidates) {
        List<String> schemed = filterSchemes(candidates);
        logger.debug("VALIDATOR", "Scheme filter kept " + schemed.size() + " of " + candidates.size() + " links");

        List<ValidatedLink> probed = probeAll(schemed);

        AcceptancePolicy acceptance = properties.getValidation().getAcceptance();
        List<String> available = new ArrayList<>();
        for (ValidatedLink link : probed) {
            System.out.println(link.toReportLine());
            if (acceptance.accepts(link.statusCode())) {
                available.add(link.url());
            }
        }

        logger.debug("VALIDATOR", "Accepted " + available.size() + " of " + probed.size() + " probed links under " + acceptance);
        return available;
    }

    public List<String> filterSchemes(Collection<String> candidates) {
        SchemeCheck schemeCheck = properties.getValidation().getSchemeCheck();
        List<String> kept = new ArrayList<>();
        for (String candidate : candidates) {
            if (schemeCheck.accepts(candidate)) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    /**
     * Probes each distinct link once, in order.
     */
    public List<ValidatedLink> probeAll(Collection<String> links) {
        List<ValidatedLink> probed = new ArrayList<>();
        for (String link : new LinkedHashSet<>(links)) {
            probed.add(new ValidatedLink(link, linkProbe.probe(link)));
        }
        return probed;
    }
}
