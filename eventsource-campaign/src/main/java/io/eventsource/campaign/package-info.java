/**
 * The campaign aggregate and its events.
 *
 * <p>{@link io.eventsource.campaign.Campaign} enforces the lifecycle,
 * {@link io.eventsource.campaign.CampaignEvent} is the closed set of facts it records,
 * {@link io.eventsource.campaign.JacksonCampaignEventCodec} stores them as JSON, and
 * {@link io.eventsource.campaign.CampaignCommands} runs commands with conflict retry.
 */
package io.eventsource.campaign;
