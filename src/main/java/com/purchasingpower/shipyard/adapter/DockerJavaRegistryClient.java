package com.purchasingpower.shipyard.adapter;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.BuildResponseItem;
import com.github.dockerjava.api.model.PullResponseItem;
import com.github.dockerjava.api.model.PushResponseItem;
import com.github.dockerjava.api.model.ResponseItem;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.transport.DockerHttpClient;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.purchasingpower.shipyard.configuration.DockerProperties;
import com.purchasingpower.shipyard.configuration.ShipyardProperties;
import com.purchasingpower.shipyard.exception.ImageBuildException;
import com.purchasingpower.shipyard.exception.ImagePushException;
import com.purchasingpower.shipyard.exception.RegistryException;
import com.purchasingpower.shipyard.model.ImageReference;
import com.purchasingpower.shipyard.model.RegistryCredential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;

@Slf4j
@Service
public class DockerJavaRegistryClient implements ContainerRegistryClient {

    private final DockerClient dockerClient;

    public DockerJavaRegistryClient(ShipyardProperties props) {
        DockerProperties docker = props.getDocker();

        DefaultDockerClientConfig.Builder configBuilder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (docker.getHost() != null && !docker.getHost().isBlank()) {
            configBuilder.withDockerHost(docker.getHost());
        }
        DefaultDockerClientConfig config = configBuilder.build();

        DockerHttpClient httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(docker.getMaxConnections())
                .build();

        this.dockerClient = DockerClientImpl.getInstance(config, httpClient);
    }

    @Override
    public void checkAuth(RegistryCredential credential) {
        try {
            dockerClient.authCmd().withAuthConfig(authConfig(credential)).exec();
        } catch (DockerException e) {
            throw new RegistryException(null,
                    "Authentication against " + credential.registryHost() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ProbeResult probe(ImageReference reference, RegistryCredential credential) {
        log.debug("Probing registry for {}", reference);

        StreamErrorCollector<PullResponseItem> callback = new StreamErrorCollector<>(item -> { });
        try {
            dockerClient.pullImageCmd(reference.repositoryName())
                    .withTag(reference.version())
                    .withAuthConfig(authConfig(credential))
                    .exec(callback)
                    .awaitCompletion();

        } catch (NotFoundException e) {
            return ProbeResult.NOT_FOUND;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException(reference.name(), "Interrupted while probing " + reference, e);
        } catch (RuntimeException e) {
            throw new RegistryException(reference.name(), "Probe for " + reference + " failed: " + e.getMessage(), e);
        }

        if (callback.getError() == null) {
            return ProbeResult.FOUND;
        }
        // Some registries answer 200 and report the missing manifest inside the stream
        String error = callback.getError().toLowerCase(Locale.ROOT);
        if (error.contains("not found") || error.contains("manifest unknown")) {
            return ProbeResult.NOT_FOUND;
        }
        throw new RegistryException(reference.name(), "Probe for " + reference + " failed: " + callback.getError());
    }

    @Override
    public String buildImage(InputStream buildContext, ImageReference reference, Consumer<BuildProgress> progress) {
        try {
            BuildImageResultCallback callback = dockerClient.buildImageCmd(buildContext)
                    .withTags(Set.of(reference.toString()))
                    .exec(new BuildImageResultCallback() {
                        @Override
                        public void onNext(BuildResponseItem item) {
                            if (item.getStream() != null) {
                                progress.accept(new BuildProgress(item.getStream(), null));
                            }
                            super.onNext(item);
                        }
                    });

            String imageId = callback.awaitImageId();
            progress.accept(new BuildProgress(null, imageId));
            return imageId;

        } catch (RuntimeException e) {
            throw new ImageBuildException(reference.name(), "Image build for " + reference + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void pushImage(ImageReference reference, RegistryCredential credential, Consumer<PushProgress> progress) {
        StreamErrorCollector<PushResponseItem> callback = new StreamErrorCollector<>(item -> progress.accept(new PushProgress(
                item.getId(),
                item.getStatus(),
                item.getProgressDetail() != null ? item.getProgressDetail().getCurrent() : null,
                item.getProgressDetail() != null ? item.getProgressDetail().getTotal() : null)));
        try {
            dockerClient.pushImageCmd(reference.repositoryName())
                    .withTag(reference.version())
                    .withAuthConfig(authConfig(credential))
                    .exec(callback)
                    .awaitCompletion();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImagePushException(reference.name(), "Interrupted while pushing " + reference, e);
        } catch (RuntimeException e) {
            throw new ImagePushException(reference.name(), "Push of " + reference + " failed: " + e.getMessage(), e);
        }

        if (callback.getError() != null) {
            throw new ImagePushException(reference.name(), "Push of " + reference + " failed: " + callback.getError());
        }
    }

    private static AuthConfig authConfig(RegistryCredential credential) {
        return new AuthConfig()
                .withUsername(credential.username())
                .withPassword(credential.password())
                .withRegistryAddress(credential.registryHost());
    }

    /**
     * Forwards stream items and remembers the first error reported inside the stream.
     */
    private static class StreamErrorCollector<T extends ResponseItem> extends ResultCallback.Adapter<T> {

        private final Consumer<T> delegate;
        private volatile String error;

        StreamErrorCollector(Consumer<T> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onNext(T item) {
            if (item.isErrorIndicated() && error == null) {
                error = item.getErrorDetail() != null ? item.getErrorDetail().getMessage() : item.getError();
            }
            delegate.accept(item);
        }

        String getError() {
            return error;
        }
    }
}
