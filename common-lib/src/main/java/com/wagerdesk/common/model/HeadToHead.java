package com.wagerdesk.common.model;

/**
 * Recent meetings between the two sides of a request.
 *
 * @param avgMarginA average margin of side A in those meetings (positive when A won)
 */
public record HeadToHead(int games, double avgTotal, double avgMarginA) {}
