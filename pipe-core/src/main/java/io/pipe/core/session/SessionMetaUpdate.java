package io.pipe.core.session;

import java.util.List;

/** Metadata patch; null fields are left as they are. */
public record SessionMetaUpdate(
    String purpose,
    String background,
    List<String> roles,
    Boolean multiStepReasoningEnabled,
    List<String> artifacts,
    String procedure,
    Hyperparameters hyperparameters
) {

    public static SessionMetaUpdate purpose(String purpose) {
        return new SessionMetaUpdate(purpose, null, null, null, null, null, null);
    }

    void applyTo(Session session) {
        if (purpose != null) {
            session.setPurpose(purpose);
        }
        if (background != null) {
            session.setBackground(background);
        }
        if (roles != null) {
            session.setRoles(roles);
        }
        if (multiStepReasoningEnabled != null) {
            session.setMultiStepReasoningEnabled(multiStepReasoningEnabled);
        }
        if (artifacts != null) {
            session.setArtifacts(artifacts);
        }
        if (procedure != null) {
            session.setProcedure(procedure);
        }
        if (hyperparameters != null) {
            session.setHyperparameters(hyperparameters);
        }
    }
}
