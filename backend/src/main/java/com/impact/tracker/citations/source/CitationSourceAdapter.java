package com.impact.tracker.citations.source;

import com.impact.tracker.citations.model.CitationBundle;
import com.impact.tracker.citations.model.CitationSource;
import com.impact.tracker.citations.model.TrackedPublication;

/**
 * Looks up one publication at one provider and returns its citing works in the
 * common {@link com.impact.tracker.citations.model.CitationRecord} shape.
 * Implementations never throw; transport and payload problems come back as
 * {@link CitationBundle.Failed}.
 */
public interface CitationSourceAdapter {

    CitationSource source();

    CitationBundle fetchByDoi(String doi);

    CitationBundle fetchByTitle(String title);

    /**
     * DOI first; the title is only used when the publication has no DOI.
     */
    default CitationBundle fetch(TrackedPublication publication) {
        if (publication.hasDoi()) {
            return fetchByDoi(publication.doi());
        }
        return fetchByTitle(publication.title());
    }
}
