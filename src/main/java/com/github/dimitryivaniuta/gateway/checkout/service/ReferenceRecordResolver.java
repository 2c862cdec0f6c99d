package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.service.dto.ReferenceRecord;
import com.github.dimitryivaniuta.gateway.checkout.service.error.InvalidReferenceException;

/**
 * Looks up the business object a checkout pays for in the record store.
 */
public interface ReferenceRecordResolver {

    /**
     * Resolves a reference record together with its line items and customer contact.
     *
     * @param referenceType reference type
     * @param referenceId reference id
     * @return resolved record
     * @throws InvalidReferenceException if the reference does not resolve to the expected chain of records
     */
    ReferenceRecord resolve(String referenceType, String referenceId);
}
