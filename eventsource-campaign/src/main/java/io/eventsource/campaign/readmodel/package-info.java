/**
 * Query side of the campaign service: the {@link io.eventsource.campaign.readmodel.CampaignReadModel}
 * view, its stores, and the {@link io.eventsource.campaign.readmodel.CampaignProjection} that
 * keeps it up to date.
 */
package io.eventsource.campaign.readmodel;
