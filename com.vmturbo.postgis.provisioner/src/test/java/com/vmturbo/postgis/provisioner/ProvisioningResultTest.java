package com.vmturbo.postgis.provisioner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import java.util.Optional;

import org.junit.Test;

import com.vmturbo.postgis.provisioner.ProvisioningException.DatabaseAlreadyExistsException;
import com.vmturbo.postgis.provisioner.ProvisioningException.SqlExecutionException;

/**
 * Tests of {@link ProvisioningResult} class.
 */
public class ProvisioningResultTest {

    /**
     * Check that both created and already-existing databases count as success.
     */
    @Test
    public void testSuccess() {
        assertThat(ProvisioningResult.created("geo_db").isSuccess(), is(true));
        assertThat(ProvisioningResult.alreadyExists("geo_db").isSuccess(), is(true));
        assertThat(ProvisioningResult.failed("geo_db", "boom").isSuccess(), is(false));
        assertThat(ProvisioningResult.created("geo_db").getReason(), is(Optional.empty()));
        assertThat(ProvisioningResult.failed("geo_db", "boom"),
                is(not(ProvisioningResult.failed("geo_db", "bang"))));
    }

    /**
     * Check that strict callers get no exception for a created database.
     *
     * @throws Exception shouldn't happen
     */
    @Test
    public void testRequireCreated() throws Exception {
        ProvisioningResult.created("geo_db").requireCreated();
    }

    /**
     * Check that strict callers get an exception for an existing database.
     *
     * @throws Exception expected
     */
    @Test(expected = DatabaseAlreadyExistsException.class)
    public void testRequireCreatedWhenExists() throws Exception {
        ProvisioningResult.alreadyExists("geo_db").requireCreated();
    }

    /**
     * Check that strict callers get the failure reason in an exception.
     */
    @Test
    public void testRequireCreatedWhenFailed() {
        try {
            ProvisioningResult.failed("geo_db", "permission denied").requireCreated();
        } catch (DatabaseAlreadyExistsException e) {
            throw new AssertionError(e);
        } catch (SqlExecutionException e) {
            assertThat(e.getMessage(), containsString("permission denied"));
            return;
        }
        throw new AssertionError("Expected SqlExecutionException");
    }
}
