package com.platform.relay.network;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.ContainerNetwork;
import com.github.dockerjava.api.model.Network;
import com.platform.relay.core.CircuitBreakerManager;
import com.platform.relay.error.DockerDaemonUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Docker network operations used for tenant isolation.
 * Every call runs through the "docker" circuit breaker; an unreachable daemon
 * surfaces as {@link DockerDaemonUnavailableException}. Missing networks and
 * already-present attachments are reported as values, not failures.
 */
@Slf4j
@Component
public class DockerNetworkClient {

    static final String BRIDGE_DRIVER = "bridge";
    static final Map<String, String> BRIDGE_OPTIONS = Map.of(
        "com.docker.network.bridge.enable_icc", "true",
        "com.docker.network.bridge.enable_ip_masquerade", "true");

    private final DockerClient dockerClient;
    private final CircuitBreaker circuitBreaker;

    public DockerNetworkClient(DockerClient dockerClient, CircuitBreakerManager circuitBreakerManager) {
        this.dockerClient = dockerClient;
        this.circuitBreaker = circuitBreakerManager.get(CircuitBreakerManager.DOCKER);
    }

    /**
     * Create a bridge network with a fixed subnet and gateway.
     *
     * @return the Docker network id
     */
    public String createNetwork(String name, Ipv4Cidr subnet, String gateway, Map<String, String> labels) {
        return callDocker("create network " + name, () -> dockerClient.createNetworkCmd()
            .withName(name)
            .withDriver(BRIDGE_DRIVER)
            .withIpam(new Network.Ipam().withConfig(new Network.Ipam.Config()
                .withSubnet(subnet.toString())
                .withGateway(gateway)))
            .withOptions(BRIDGE_OPTIONS)
            .withLabels(labels)
            .exec()
            .getId());
    }

    public Optional<DockerNetwork> inspectNetwork(String idOrName) {
        return callDocker("inspect network " + idOrName, () -> {
            try {
                return Optional.of(toDockerNetwork(dockerClient.inspectNetworkCmd().withNetworkId(idOrName).exec()));
            } catch (NotFoundException e) {
                return Optional.empty();
            }
        });
    }

    public List<DockerNetwork> listNetworks() {
        return callDocker("list networks", () -> dockerClient.listNetworksCmd().exec().stream()
            .map(DockerNetworkClient::toDockerNetwork)
            .toList());
    }

    /**
     * Attach a container to a network at a fixed address.
     *
     * @return false when the container was already attached
     */
    public boolean connectContainer(String networkId, String containerId, String ipv4Address) {
        return callDocker("connect " + containerId + " to " + networkId, () -> {
            try {
                dockerClient.connectToNetworkCmd()
                    .withNetworkId(networkId)
                    .withContainerId(containerId)
                    .withContainerNetwork(new ContainerNetwork()
                        .withIpamConfig(new ContainerNetwork.Ipam().withIpv4Address(ipv4Address)))
                    .exec();
                return true;
            } catch (ConflictException e) {
                log.debug("Container {} already attached to {}", containerId, networkId);
                return false;
            } catch (DockerException e) {
                if (isAlreadyAttached(e)) {
                    log.debug("Container {} already attached to {}", containerId, networkId);
                    return false;
                }
                throw e;
            }
        });
    }

    /**
     * @return false when the network or the attachment did not exist
     */
    public boolean disconnectContainer(String networkId, String containerId) {
        return callDocker("disconnect " + containerId + " from " + networkId, () -> {
            try {
                dockerClient.disconnectFromNetworkCmd()
                    .withNetworkId(networkId)
                    .withContainerId(containerId)
                    .withForce(true)
                    .exec();
                return true;
            } catch (NotFoundException e) {
                return false;
            } catch (DockerException e) {
                if (messageContains(e, "is not connected")) {
                    return false;
                }
                throw e;
            }
        });
    }

    /**
     * @return false when the network was already gone
     */
    public boolean removeNetwork(String networkId) {
        return callDocker("remove network " + networkId, () -> {
            try {
                dockerClient.removeNetworkCmd(networkId).exec();
                return true;
            } catch (NotFoundException e) {
                return false;
            }
        });
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        try {
            return circuitBreaker.executeSupplier(supplier);
        } catch (CallNotPermittedException e) {
            throw new DockerDaemonUnavailableException(action, e);
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof DockerDaemonUnavailableException) {
            return e;
        }
        if (isDockerUnavailable(e)) {
            return new DockerDaemonUnavailableException(action, e);
        }
        return e;
    }

    static boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAlreadyAttached(DockerException e) {
        return e.getHttpStatus() == 403 || messageContains(e, "already exists");
    }

    private static boolean messageContains(Throwable t, String fragment) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }

    private static DockerNetwork toDockerNetwork(Network network) {
        List<Ipv4Cidr> subnets = network.getIpam() == null || network.getIpam().getConfig() == null
            ? List.of()
            : network.getIpam().getConfig().stream()
                .map(Network.Ipam.Config::getSubnet)
                .map(Ipv4Cidr::tryParse)
                .flatMap(Optional::stream)
                .toList();
        return new DockerNetwork(network.getId(), network.getName(), subnets, network.getLabels());
    }
}
