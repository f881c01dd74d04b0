package com.flamingo.ai.coursepipeline.domain.repository;

import java.util.UUID;

/**
 * Identity of a material together with its owning chapter, course and user, loaded in one query
 * so workers never touch lazy associations outside a session.
 *
 * @param materialId material id
 * @param chapterId owning chapter id
 * @param courseId owning course id
 * @param userId owner of the course, the notification target
 * @param courseLanguage content language of the course
 */
public record MaterialContext(
    UUID materialId, UUID chapterId, UUID courseId, UUID userId, String courseLanguage) {}
