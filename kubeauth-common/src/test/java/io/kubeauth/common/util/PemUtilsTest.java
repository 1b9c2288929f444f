/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.kubeauth.common.util;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertThrows;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.util.Date;
import java.util.List;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.testng.annotations.Test;

public class PemUtilsTest {

    static String toPem(Object object) throws IOException {
        StringWriter writer = new StringWriter();
        try (JcaPEMWriter pemWriter = new JcaPEMWriter(writer)) {
            pemWriter.writeObject(object);
        }
        return writer.toString();
    }

    static KeyPair rsaKeyPair() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        return generator.generateKeyPair();
    }

    static KeyPair ecKeyPair() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp384r1"));
        return generator.generateKeyPair();
    }

    static X509Certificate selfSigned(KeyPair keyPair, String cn) throws Exception {
        X500Name name = new X500Name("CN=" + cn);
        long now = System.currentTimeMillis();
        X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(name, BigInteger.valueOf(now),
                new Date(now - 60_000), new Date(now + 3_600_000), name, keyPair.getPublic());
        return new JcaX509CertificateConverter().getCertificate(
                builder.build(new JcaContentSignerBuilder("SHA256withRSA").build(keyPair.getPrivate())));
    }

    @Test
    public void testParseRsaAndEcPublicKeys() throws Exception {
        KeyPair rsa = rsaKeyPair();
        KeyPair ec = ecKeyPair();

        List<PublicKey> keys = PemUtils.parsePublicKeys(toPem(rsa.getPublic()) + toPem(ec.getPublic()));

        assertEquals(keys.size(), 2);
        assertEquals(keys.get(0).getEncoded(), rsa.getPublic().getEncoded());
        assertEquals(keys.get(1).getAlgorithm(), "EC");
        assertEquals(keys.get(1).getEncoded(), ec.getPublic().getEncoded());
    }

    @Test
    public void testParsePublicKeyFromCertificate() throws Exception {
        KeyPair rsa = rsaKeyPair();
        X509Certificate certificate = selfSigned(rsa, "kubernetes");

        List<PublicKey> keys = PemUtils.parsePublicKeys(toPem(certificate));

        assertEquals(keys.size(), 1);
        assertEquals(keys.get(0).getEncoded(), rsa.getPublic().getEncoded());
    }

    @Test
    public void testParseCertificates() throws Exception {
        X509Certificate first = selfSigned(rsaKeyPair(), "ca-1");
        X509Certificate second = selfSigned(rsaKeyPair(), "ca-2");

        List<X509Certificate> certificates = PemUtils.parseCertificates(toPem(first) + "\n" + toPem(second));

        assertEquals(certificates.size(), 2);
        assertEquals(certificates.get(0), first);
        assertEquals(certificates.get(1), second);
    }

    @Test
    public void testRejectInvalidInput() throws Exception {
        assertThrows(IOException.class, () -> PemUtils.parsePublicKeys(""));
        assertThrows(IOException.class, () -> PemUtils.parsePublicKeys("not a pem"));
        assertThrows(IOException.class, () -> PemUtils.parseCertificates(toPem(rsaKeyPair().getPublic())));
        assertThrows(IOException.class, () -> PemUtils.parseCertificates(null));
    }
}
