/**
 * REST API: chat, conversations, documents and document matches.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/chat} - ask a question in a conversation</li>
 *   <li>{@code /api/v1/conversations} - create, list, delete conversations; upload and list documents</li>
 *   <li>{@code GET /api/v1/documents/{id}/preview} - document text with usage statistics</li>
 *   <li>{@code GET /api/v1/messages/{id}/document-matches} - documents that answered a message</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.docqa.api;
