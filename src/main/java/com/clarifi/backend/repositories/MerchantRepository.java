package com.clarifi.backend.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.clarifi.backend.entities.Merchant;

public interface MerchantRepository extends JpaRepository<Merchant, UUID> {
}
