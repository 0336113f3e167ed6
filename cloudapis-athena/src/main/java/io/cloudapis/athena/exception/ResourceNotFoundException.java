package io.cloudapis.athena.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.JsonFields;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

public final class ResourceNotFoundException extends ClientException {

    private static final long serialVersionUID = 1L;

    private final String resourceName;

    public ResourceNotFoundException(Response response, AwsError error) {
        super(response, error);
        this.resourceName = JsonFields.diagnostic(error.body(), "ResourceName");
    }

    /** The name of the resource that was not found. */
    public String getResourceName() {
        return resourceName;
    }
}
