/**
 * REST API controllers for the local UI.
 *
 * <ul>
 *   <li>{@code GET /api/backend/status}, {@code POST /api/backend/restart}</li>
 *   <li>{@code POST|GET /api/recovery/errors}, {@code GET /api/recovery/errors/count},
 *       {@code GET /api/recovery/attempts}, {@code DELETE /api/recovery/history}</li>
 *   <li>{@code POST|GET /api/system/restart}, {@code POST /api/system/restart/quick}</li>
 * </ul>
 *
 * @see com.phillippitts.newwork.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.newwork.presentation.controller;
