package com.vmturbo.postgis.provisioner;

import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.vmturbo.postgis.provisioner.ProvisioningException.DatabaseAlreadyExistsException;
import com.vmturbo.postgis.provisioner.ProvisioningException.SqlExecutionException;

/**
 * Outcome of a database creation attempt.
 */
public class ProvisioningResult {

    /**
     * Possible outcomes.
     */
    public enum Outcome {
        /** The database was created. */
        CREATED,
        /** The database already existed; nothing was changed. */
        ALREADY_EXISTS,
        /** Creation failed. */
        FAILED
    }

    private final Outcome outcome;
    private final String databaseName;
    private final String reason;

    private ProvisioningResult(Outcome outcome, String databaseName, @Nullable String reason) {
        this.outcome = outcome;
        this.databaseName = databaseName;
        this.reason = reason;
    }

    /**
     * Result for a newly created database.
     *
     * @param databaseName database name
     * @return result
     */
    public static ProvisioningResult created(@Nonnull String databaseName) {
        return new ProvisioningResult(Outcome.CREATED, databaseName, null);
    }

    /**
     * Result for a database that was already present.
     *
     * @param databaseName database name
     * @return result
     */
    public static ProvisioningResult alreadyExists(@Nonnull String databaseName) {
        return new ProvisioningResult(Outcome.ALREADY_EXISTS, databaseName, null);
    }

    /**
     * Result for a failed creation.
     *
     * @param databaseName database name
     * @param reason       failure description, normally the server's message
     * @return result
     */
    public static ProvisioningResult failed(@Nonnull String databaseName, @Nonnull String reason) {
        return new ProvisioningResult(Outcome.FAILED, databaseName, Objects.requireNonNull(reason));
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Whether the database is now present, either because it was created or because it already
     * existed.
     *
     * @return true unless creation failed
     */
    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }

    /**
     * Convert this result into an exception for callers that do not want idempotent semantics.
     *
     * @throws DatabaseAlreadyExistsException if the database already existed
     * @throws SqlExecutionException          if creation failed
     */
    public void requireCreated() throws DatabaseAlreadyExistsException, SqlExecutionException {
        switch (outcome) {
            case CREATED:
                return;
            case ALREADY_EXISTS:
                throw new DatabaseAlreadyExistsException(databaseName);
            default:
                throw new SqlExecutionException(String.format(
                        "Failed to create database %s: %s", databaseName, reason));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProvisioningResult)) {
            return false;
        }
        final ProvisioningResult that = (ProvisioningResult)o;
        return outcome == that.outcome && databaseName.equals(that.databaseName)
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outcome, databaseName, reason);
    }

    @Override
    public String toString() {
        return reason == null ? String.format("%s(%s)", outcome, databaseName)
                : String.format("%s(%s: %s)", outcome, databaseName, reason);
    }
}
