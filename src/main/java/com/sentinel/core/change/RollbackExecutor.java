package com.sentinel.core.change;

import com.sentinel.core.error.RollbackFailureException;

/**
 * Runs a change request's rollback procedure.
 */
public interface RollbackExecutor {

    /**
     * @throws RollbackFailureException if the procedure could not be carried out
     */
    RollbackReport execute(ChangeRequest request, String reason);
}
