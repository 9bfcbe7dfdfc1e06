package com.privacy.signalaudit.session;

import com.privacy.signalaudit.model.ConsentAction;
import lombok.Builder;
import lombok.Value;

/**
 * What a session saw on a page after it loaded.
 */
@Value
@Builder
public class PageObservation {
    boolean cookieBannerPresent;
    boolean optOutLinkPresent;
    @Builder.Default
    ConsentAction consentAction = ConsentAction.NOT_ATTEMPTED;
}
