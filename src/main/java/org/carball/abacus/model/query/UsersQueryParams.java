package org.carball.abacus.model.query;

import lombok.Builder;
import lombok.Data;
import org.carball.abacus.model.definition.IdentifierType;
import org.carball.abacus.model.definition.SegmentDefinition;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
public class UsersQueryParams implements PageQueryParams {
    private String name;
    private Instant from;
    private Instant to;
    private String urlRegex;

    @Builder.Default
    private IdentifierType userIdType = IdentifierType.ANONYMOUS;

    @Builder.Default
    private int conversionWindowDays = 3;

    private boolean includeByDate;
    private SegmentDefinition segment;
}
