package com.purchasingpower.shipyard.adapter;

import com.purchasingpower.shipyard.exception.ImageBuildException;
import com.purchasingpower.shipyard.exception.ImagePushException;
import com.purchasingpower.shipyard.exception.RegistryException;
import com.purchasingpower.shipyard.model.ImageReference;
import com.purchasingpower.shipyard.model.RegistryCredential;

import java.io.InputStream;
import java.util.function.Consumer;

/**
 * Container daemon and registry operations needed to publish one image.
 * All calls block until the daemon reports completion.
 */
public interface ContainerRegistryClient {

    /**
     * @throws RegistryException when the registry rejects the credential
     */
    void checkAuth(RegistryCredential credential);

    /**
     * Cheap existence check for {@code reference} at the remote registry.
     *
     * @throws RegistryException for any failure other than "not found"
     */
    ProbeResult probe(ImageReference reference, RegistryCredential credential);

    /**
     * Builds an image from a tar build context and tags it with {@code reference}.
     *
     * @return id of the built image
     * @throws ImageBuildException when the build stream reports an error
     */
    String buildImage(InputStream buildContext, ImageReference reference, Consumer<BuildProgress> progress);

    /**
     * @throws ImagePushException when the push stream reports an error
     */
    void pushImage(ImageReference reference, RegistryCredential credential, Consumer<PushProgress> progress);
}
