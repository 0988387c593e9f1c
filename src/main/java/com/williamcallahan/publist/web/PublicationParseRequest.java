package com.williamcallahan.publist.web;

/**
 * JSON body for parsing a pasted publication list.
 *
 * @param content pasted text; null is treated as empty
 */
public record PublicationParseRequest(String content) {}
