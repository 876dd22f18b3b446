package com.example.clipnotes_backend.repository;

import com.example.clipnotes_backend.model.Clip;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ClipRepository extends JpaRepository<Clip, UUID> {
    List<Clip> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
