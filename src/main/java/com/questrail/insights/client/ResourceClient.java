package com.questrail.insights.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.insights.model.Device;
import com.questrail.insights.model.NetworkClient;
import com.questrail.insights.model.Site;

import java.util.List;

/**
 * ResourceClient
 * -----------------------------------------------------------------------------
 * Port to the network management API: the pull side of synchronization.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Every method is blocking and may be called from any thread.</li>
 *   <li>Implementations serialize outgoing calls through a single request gate,
 *       so concurrent callers queue rather than overwhelm the remote host.</li>
 *   <li>Failures are reported as {@link InsightsApiException} subclasses; no
 *       method returns {@code null}.</li>
 * </ul>
 */
public interface ResourceClient
{
    List<Site> listSites();

    List<Device> listDevices(String siteId);

    /**
     * Supplementary device details (firmware version and similar) to be
     * overlaid on the listing record.
     */
    JsonNode getDeviceInfo(String siteId, String deviceId);

    /** Latest statistics object for one device. */
    JsonNode getDeviceStats(String siteId, String deviceId);

    List<NetworkClient> listClients(String siteId);

    /**
     * @return {@code true} if the remote API acknowledged the command
     */
    boolean sendDeviceCommand(String siteId, String deviceId, DeviceCommand command);
}
