package com.mockgen.generator.codegen.extract;

import java.util.List;

import com.mockgen.generator.codegen.exception.ExtractionException;
import com.mockgen.generator.codegen.model.InterfaceModel;
import com.mockgen.generator.codegen.model.request.ExtractionRequest;

/**
 * Builds interface models from a request. Implementations are interchangeable and produce
 * structurally equal models for the same interface; they differ only in parameter-name fidelity.
 */
public interface InterfaceExtractor {

    /**
     * @return one model per requested interface, in request order
     * @throws ExtractionException if an interface cannot be found, resolved or flattened
     */
    List<InterfaceModel> extract(ExtractionRequest request);
}
