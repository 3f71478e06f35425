package com.phillippitts.voicegate.service.broker;

import com.phillippitts.voicegate.domain.ModelTier;
import com.phillippitts.voicegate.domain.VoiceProfile;
import com.phillippitts.voicegate.exception.ProviderRequestException;
import com.phillippitts.voicegate.exception.ProviderUnavailableException;

/**
 * Obtains ephemeral credentials from the speech provider.
 */
public interface CredentialBroker {

    /**
     * Requests a credential for one session.
     *
     * @param modelTier    model the session will use
     * @param voiceProfile output voice
     * @return fresh credential with a new session id
     * @throws ProviderUnavailableException when transient failures exhausted the retry budget
     * @throws ProviderRequestException     when the provider rejected the request or answered garbage
     */
    EphemeralSession createSession(ModelTier modelTier, VoiceProfile voiceProfile);
}
