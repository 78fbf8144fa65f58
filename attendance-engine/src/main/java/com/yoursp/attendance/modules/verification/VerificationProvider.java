package com.yoursp.attendance.modules.verification;

import com.yoursp.attendance.modules.verification.dto.VerificationOutcome;
import com.yoursp.attendance.modules.verification.exception.ProviderUnavailableException;

import java.util.UUID;

/**
 * Identity check against a captured sample. The matching algorithm lives
 * behind this contract.
 */
public interface VerificationProvider {

    /**
     * @param userId    the user whose enrolled reference the sample is compared to
     * @param sampleRef reference to the captured sample (storage key or data URI)
     * @return the provider's verdict
     * @throws ProviderUnavailableException if the provider cannot answer
     */
    VerificationOutcome verify(UUID userId, String sampleRef);
}
