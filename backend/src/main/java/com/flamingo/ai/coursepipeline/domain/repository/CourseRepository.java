package com.flamingo.ai.coursepipeline.domain.repository;

import com.flamingo.ai.coursepipeline.domain.entity.Course;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Course entities. */
@Repository
public interface CourseRepository extends JpaRepository<Course, UUID> {}
